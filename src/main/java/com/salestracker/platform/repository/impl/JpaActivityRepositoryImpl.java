package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Activity;
import com.salestracker.platform.repository.ActivityRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("!local")
public class JpaActivityRepositoryImpl implements ActivityRepository {

    private final JpaActivityRepository jpaRepository;

    @Autowired
    public JpaActivityRepositoryImpl(JpaActivityRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Activity save(Activity activity) {
        return jpaRepository.save(activity);
    }

    @Override
    public Optional<Activity> findById(String activityId) {
        return jpaRepository.findById(activityId);
    }

    @Override
    public void deleteById(String activityId) {
        jpaRepository.deleteById(activityId);
    }

    @Override
    public List<Activity> findByUserId(String userId, int limit) {
        return jpaRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit));
    }

    @Override
    public List<Activity> findByUserIdAndDate(String userId, LocalDate date, int limit) {
        return jpaRepository.findByUserIdAndDateOrderByCreatedAtDesc(userId, date, PageRequest.of(0, limit));
    }

    @Override
    public List<Activity> findByDateRange(String userId, LocalDate startDate, LocalDate endDate) {
        if (userId == null) {
            return jpaRepository.findByDateBetween(startDate, endDate);
        }
        return jpaRepository.findByUserIdAndDateBetween(userId, startDate, endDate);
    }

    @Override
    public List<Activity> findAll() {
        return jpaRepository.findAll();
    }
}
