package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Activity;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
@Profile("!local")
public interface JpaActivityRepository extends JpaRepository<Activity, String> {
    List<Activity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
    List<Activity> findByUserIdAndDateOrderByCreatedAtDesc(String userId, LocalDate date, Pageable pageable);
    List<Activity> findByDateBetween(LocalDate startDate, LocalDate endDate);
    List<Activity> findByUserIdAndDateBetween(String userId, LocalDate startDate, LocalDate endDate);
}
