package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Activity;
import com.salestracker.platform.repository.ActivityRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("local")
public class JsonActivityRepository implements ActivityRepository {

    private static final Comparator<Activity> NEWEST_FIRST =
        Comparator.comparing(Activity::getCreatedAt).reversed().thenComparing(Activity::getActivityId);

    private final JsonDocumentCollection<Activity> activities;

    public JsonActivityRepository(@Value("${salestracker.storage.directory:./data}") String dataDirectory) {
        this.activities = new JsonDocumentCollection<>(dataDirectory, "activities", Activity.class,
            Activity::getActivityId);
    }

    @Override
    public Activity save(Activity activity) {
        if (activity == null || activity.getActivityId() == null) {
            throw new IllegalArgumentException("Activity id cannot be null");
        }
        return activities.save(activity);
    }

    @Override
    public Optional<Activity> findById(String activityId) {
        return activities.findById(activityId);
    }

    @Override
    public void deleteById(String activityId) {
        activities.delete(activityId);
    }

    @Override
    public List<Activity> findByUserId(String userId, int limit) {
        return activities.findAll().stream()
            .filter(activity -> activity.getUserId().equals(userId))
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }

    @Override
    public List<Activity> findByUserIdAndDate(String userId, LocalDate date, int limit) {
        return activities.findAll().stream()
            .filter(activity -> activity.getUserId().equals(userId))
            .filter(activity -> activity.getDate().equals(date))
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }

    @Override
    public List<Activity> findByDateRange(String userId, LocalDate startDate, LocalDate endDate) {
        return activities.findAll().stream()
            .filter(activity -> userId == null || activity.getUserId().equals(userId))
            .filter(activity -> !activity.getDate().isBefore(startDate) && !activity.getDate().isAfter(endDate))
            .toList();
    }

    @Override
    public List<Activity> findAll() {
        return activities.findAll();
    }
}
