package com.salestracker.platform.repository;

import com.salestracker.platform.model.Activity;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ActivityRepository {
    Activity save(Activity activity);
    Optional<Activity> findById(String activityId);
    void deleteById(String activityId);

    /**
     * Activities of one user, newest first.
     */
    List<Activity> findByUserId(String userId, int limit);

    List<Activity> findByUserIdAndDate(String userId, LocalDate date, int limit);

    /**
     * Inclusive date range; {@code userId} may be null to span every user.
     */
    List<Activity> findByDateRange(String userId, LocalDate startDate, LocalDate endDate);

    List<Activity> findAll();
}
