package com.salestracker.platform.service;

import com.salestracker.platform.dto.DailyTrend;
import com.salestracker.platform.dto.TypeBreakdown;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.ActivityType;
import com.salestracker.platform.model.LeaderboardPeriod;
import com.salestracker.platform.repository.ActivityRepository;
import com.salestracker.platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    @Mock
    private ActivityRepository activityRepository;

    private AnalyticsService analyticsService;
    private final LocalDate today = LocalDate.of(2024, 3, 10);

    @BeforeEach
    void setUp() {
        analyticsService = new AnalyticsService(activityRepository, MutableClock.at("2024-03-10T03:00:00Z"));
    }

    private static Activity activity(ActivityType type, int points, LocalDate date) {
        return Activity.builder().userId("u1").activityType(type).points(points).date(date).build();
    }

    @Test
    void testGetTrends_GroupsByDayOldestFirst() {
        when(activityRepository.findByDateRange("u1", today.minusDays(7), today)).thenReturn(List.of(
            activity(ActivityType.CALL, 10, today),
            activity(ActivityType.MEETING, 30, today.minusDays(2)),
            activity(ActivityType.CALL, 5, today)));

        List<DailyTrend> trends = analyticsService.getTrends("u1", 7);

        assertEquals(2, trends.size());
        assertEquals(today.minusDays(2), trends.get(0).getDate());
        assertEquals(15, trends.get(1).getTotal());
        assertEquals(15L, trends.get(1).getTypes().get("CALL"));
    }

    @Test
    void testGetTrends_RejectsNonPositiveDays() {
        assertThrows(InvalidRequestException.class, () -> analyticsService.getTrends("u1", 0));
    }

    @Test
    void testGetBreakdown_SortedByPointsWithPercentages() {
        when(activityRepository.findByDateRange(null, today.minusDays(7), today)).thenReturn(List.of(
            activity(ActivityType.CALL, 10, today),
            activity(ActivityType.CALL, 15, today),
            activity(ActivityType.CONTRACT, 75, today)));

        List<TypeBreakdown> breakdown = analyticsService.getBreakdown(null, LeaderboardPeriod.WEEKLY);

        assertEquals(ActivityType.CONTRACT, breakdown.get(0).getType());
        assertEquals(75, breakdown.get(0).getPercentage());
        assertEquals(2, breakdown.get(1).getCount());
        assertEquals(25, breakdown.get(1).getPercentage());
    }
}
