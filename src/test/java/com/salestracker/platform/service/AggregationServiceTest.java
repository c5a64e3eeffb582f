package com.salestracker.platform.service;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.dto.Leaderboard;
import com.salestracker.platform.dto.LeaderboardEntry;
import com.salestracker.platform.dto.TeamStats;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.ActivityType;
import com.salestracker.platform.model.LeaderboardPeriod;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.ActivityRepository;
import com.salestracker.platform.repository.UserRepository;
import com.salestracker.platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AggregationServiceTest {

    @Mock
    private ActivityRepository activityRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private CacheService cacheService;

    private AggregationService aggregationService;

    private final MutableClock clock = MutableClock.at("2024-03-13T03:00:00Z");
    private final LocalDate today = LocalDate.of(2024, 3, 13);

    @BeforeEach
    void setUp() {
        aggregationService = new AggregationService(activityRepository, userRepository, cacheService,
            new SalesTrackerProperties(), clock);
    }

    private static Activity activity(String userId, int points, LocalDate date) {
        return Activity.builder()
            .activityId(UUID.randomUUID().toString())
            .userId(userId)
            .activityType(ActivityType.CALL)
            .title("Call")
            .points(points)
            .date(date)
            .build();
    }

    private static User user(String userId) {
        return User.builder().userId(userId).displayName("Name " + userId).build();
    }

    @SuppressWarnings("unchecked")
    private void passThroughCache() {
        when(cacheService.getOrCompute(anyString(), any(Duration.class), any(Class.class), any(Supplier.class)))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(3)).get());
    }

    @Test
    void testGetLeaderboard_OrderedByPointsThenUserId() {
        // Arrange
        passThroughCache();
        when(activityRepository.findByDateRange(null, today, today)).thenReturn(List.of(
            activity("carol", 40, today),
            activity("bob", 30, today),
            activity("alice", 20, today),
            activity("alice", 20, today),
            activity("dave", 100, today)));
        when(userRepository.findById(anyString()))
            .thenAnswer(invocation -> Optional.of(user(invocation.getArgument(0))));

        // Act
        Leaderboard leaderboard = aggregationService.getLeaderboard(LeaderboardPeriod.DAILY, today);

        // Assert
        List<LeaderboardEntry> entries = leaderboard.getEntries();
        assertEquals(List.of("dave", "alice", "carol", "bob"),
            entries.stream().map(LeaderboardEntry::getUserId).toList());
        for (int i = 0; i < entries.size(); i++) {
            assertEquals(i + 1, entries.get(i).getRank());
            if (i > 0) {
                assertTrue(entries.get(i - 1).getPoints() >= entries.get(i).getPoints());
            }
        }
        assertEquals(2, entries.get(1).getActivities());
        assertEquals(4, leaderboard.getTotalParticipants());
    }

    @Test
    void testGetLeaderboard_SkipsParticipantsWithoutUserRecord() {
        passThroughCache();
        when(activityRepository.findByDateRange(null, today, today)).thenReturn(List.of(
            activity("alice", 10, today),
            activity("orphan", 90, today)));
        when(userRepository.findById("alice")).thenReturn(Optional.of(user("alice")));
        when(userRepository.findById("orphan")).thenReturn(Optional.empty());

        Leaderboard leaderboard = aggregationService.getLeaderboard(LeaderboardPeriod.DAILY, today);

        assertEquals(1, leaderboard.getEntries().size());
        assertEquals("alice", leaderboard.getEntries().get(0).getUserId());
        assertEquals(1, leaderboard.getEntries().get(0).getRank());
    }

    @Test
    void testGetLeaderboard_WeeklyUsesWeekWindowAndKey() {
        passThroughCache();
        LocalDate monday = LocalDate.of(2024, 3, 11);
        LocalDate sunday = LocalDate.of(2024, 3, 17);
        when(activityRepository.findByDateRange(null, monday, sunday)).thenReturn(List.of());

        Leaderboard leaderboard = aggregationService.getLeaderboard(LeaderboardPeriod.WEEKLY, today);

        assertEquals(monday, leaderboard.getStartDate());
        assertEquals(sunday, leaderboard.getEndDate());
        assertTrue(leaderboard.getEntries().isEmpty());
        verify(cacheService).getOrCompute(eq("leaderboard_weekly_2024-03-11"), eq(Duration.ofMinutes(5)),
            eq(Leaderboard.class), any());
    }

    @Test
    void testGetTeamStats_Totals() {
        // Arrange
        passThroughCache();
        when(userRepository.findAll()).thenReturn(List.of(user("alice"), user("bob"), user("carol")));
        when(activityRepository.findAll()).thenReturn(List.of(
            activity("alice", 50, today),
            activity("alice", 25, today.minusDays(1)),
            activity("bob", 10, today),
            activity("orphan", 500, today)));

        // Act
        TeamStats stats = aggregationService.getTeamStats();

        // Assert
        assertEquals(3, stats.getTotalUsers());
        assertEquals(585, stats.getTotalPoints());
        assertEquals(4, stats.getTotalActivities());
        assertEquals(560, stats.getTodayPoints());
        assertEquals(3, stats.getTodayActivities());
        assertEquals(3, stats.getActiveUsersToday());
        assertEquals(List.of("alice", "bob"),
            stats.getTopPerformers().stream().map(p -> p.getUserId()).toList());
        assertEquals(75, stats.getTopPerformers().get(0).getPoints());
        assertEquals(clock.instant(), stats.getCalculatedAt());
    }

    @Test
    void testGetTeamStats_TopPerformersCappedAtFive() {
        passThroughCache();
        List<User> users = List.of(user("u1"), user("u2"), user("u3"), user("u4"), user("u5"), user("u6"));
        when(userRepository.findAll()).thenReturn(users);
        when(activityRepository.findAll()).thenReturn(users.stream()
            .map(u -> activity(u.getUserId(), 10, today))
            .toList());

        TeamStats stats = aggregationService.getTeamStats();

        assertEquals(5, stats.getTopPerformers().size());
        assertEquals("u1", stats.getTopPerformers().get(0).getUserId());
    }

    @Test
    void testEvictFor_DropsTeamStatsAndEveryPeriodKey() {
        aggregationService.evictFor(today);

        verify(cacheService).evict("team_stats");
        verify(cacheService).evict("leaderboard_daily_2024-03-13");
        verify(cacheService).evict("leaderboard_weekly_2024-03-11");
        verify(cacheService).evict("leaderboard_monthly_2024-03-01");
        verifyNoMoreInteractions(cacheService);
    }
}
