package com.salestracker.platform.service;

import com.salestracker.platform.dto.DailyTrend;
import com.salestracker.platform.dto.TypeBreakdown;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.ActivityType;
import com.salestracker.platform.model.LeaderboardPeriod;
import com.salestracker.platform.repository.ActivityRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-user activity trends and type breakdowns. Uncached; both scans are bounded by a date window.
 */
@Service
public class AnalyticsService {

    static final int MAX_TREND_DAYS = 366;

    private final ActivityRepository activityRepository;
    private final Clock clock;

    @Autowired
    public AnalyticsService(ActivityRepository activityRepository, Clock clock) {
        this.activityRepository = activityRepository;
        this.clock = clock;
    }

    /**
     * Points per day over the last {@code days} days, split by activity type, oldest day first.
     */
    public List<DailyTrend> getTrends(String userId, int days) {
        if (days <= 0 || days > MAX_TREND_DAYS) {
            throw new InvalidRequestException("days must be between 1 and " + MAX_TREND_DAYS);
        }
        LocalDate endDate = LocalDate.now(clock);
        LocalDate startDate = endDate.minusDays(days);

        Map<LocalDate, DailyTrend> trends = new TreeMap<>();
        for (Activity activity : activityRepository.findByDateRange(userId, startDate, endDate)) {
            DailyTrend trend = trends.computeIfAbsent(activity.getDate(),
                date -> DailyTrend.builder().date(date).build());
            trend.setTotal(trend.getTotal() + activity.getPoints());
            trend.getTypes().merge(activity.getActivityType().name(), (long) activity.getPoints(), Long::sum);
        }
        return new ArrayList<>(trends.values());
    }

    /**
     * Count, points and share of points per activity type, highest points first.
     */
    public List<TypeBreakdown> getBreakdown(String userId, LeaderboardPeriod period) {
        LocalDate today = LocalDate.now(clock);
        LocalDate startDate;
        switch (period == null ? LeaderboardPeriod.MONTHLY : period) {
            case DAILY:
                startDate = today;
                break;
            case WEEKLY:
                startDate = today.minusDays(7);
                break;
            default:
                startDate = today.minusMonths(1);
        }

        Map<ActivityType, TypeBreakdown> breakdown = new EnumMap<>(ActivityType.class);
        long totalPoints = 0;
        for (Activity activity : activityRepository.findByDateRange(userId, startDate, today)) {
            TypeBreakdown item = breakdown.computeIfAbsent(activity.getActivityType(),
                type -> TypeBreakdown.builder().type(type).build());
            item.setCount(item.getCount() + 1);
            item.setPoints(item.getPoints() + activity.getPoints());
            totalPoints += activity.getPoints();
        }

        for (TypeBreakdown item : breakdown.values()) {
            item.setPercentage(totalPoints > 0 ? (int) Math.round(item.getPoints() * 100.0 / totalPoints) : 0);
        }

        return breakdown.values().stream()
            .sorted(Comparator.comparingLong(TypeBreakdown::getPoints).reversed())
            .toList();
    }
}
