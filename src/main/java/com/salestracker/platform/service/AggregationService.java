package com.salestracker.platform.service;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.dto.Leaderboard;
import com.salestracker.platform.dto.LeaderboardEntry;
import com.salestracker.platform.dto.TeamStats;
import com.salestracker.platform.dto.TopPerformer;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.LeaderboardPeriod;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.ActivityRepository;
import com.salestracker.platform.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Team statistics and period leaderboards, recomputed in batch from raw activities and served
 * through {@link CacheService}.
 */
@Service
public class AggregationService {

    private static final Logger logger = LoggerFactory.getLogger(AggregationService.class);

    static final String TEAM_STATS_KEY = "team_stats";
    private static final int TOP_PERFORMER_COUNT = 5;

    private final ActivityRepository activityRepository;
    private final UserRepository userRepository;
    private final CacheService cacheService;
    private final SalesTrackerProperties properties;
    private final Clock clock;

    @Autowired
    public AggregationService(
            ActivityRepository activityRepository,
            UserRepository userRepository,
            CacheService cacheService,
            SalesTrackerProperties properties,
            Clock clock) {
        this.activityRepository = activityRepository;
        this.userRepository = userRepository;
        this.cacheService = cacheService;
        this.properties = properties;
        this.clock = clock;
    }

    public TeamStats getTeamStats() {
        return cacheService.getOrCompute(TEAM_STATS_KEY, properties.getCache().getTeamStatsTtl(),
            TeamStats.class, this::calculateTeamStats);
    }

    /**
     * @param date any day inside the wanted window; null means today
     */
    public Leaderboard getLeaderboard(LeaderboardPeriod period, LocalDate date) {
        if (period == null) {
            period = LeaderboardPeriod.DAILY;
        }
        LeaderboardPeriod resolvedPeriod = period;
        LocalDate targetDate = date != null ? date : LocalDate.now(clock);
        return cacheService.getOrCompute(resolvedPeriod.cacheKey(targetDate),
            properties.getCache().getLeaderboardTtl(), Leaderboard.class,
            () -> calculateLeaderboard(resolvedPeriod, targetDate));
    }

    /**
     * Drops every cached aggregate that includes activities dated {@code date}.
     */
    public void evictFor(LocalDate date) {
        cacheService.evict(TEAM_STATS_KEY);
        for (LeaderboardPeriod period : LeaderboardPeriod.values()) {
            cacheService.evict(period.cacheKey(date));
        }
    }

    TeamStats calculateTeamStats() {
        LocalDate today = LocalDate.now(clock);
        List<User> users = userRepository.findAll();
        List<Activity> activities = activityRepository.findAll();

        long totalPoints = 0;
        long todayPoints = 0;
        long todayActivities = 0;
        Set<String> activeToday = new HashSet<>();
        Map<String, Long> pointsByUser = new HashMap<>();

        for (Activity activity : activities) {
            totalPoints += activity.getPoints();
            if (today.equals(activity.getDate())) {
                todayActivities++;
                todayPoints += activity.getPoints();
                activeToday.add(activity.getUserId());
            }
            pointsByUser.merge(activity.getUserId(), (long) activity.getPoints(), Long::sum);
        }

        Map<String, User> usersById = users.stream()
            .collect(Collectors.toMap(User::getUserId, Function.identity(), (first, second) -> first));

        List<TopPerformer> topPerformers = pointsByUser.entrySet().stream()
            .filter(entry -> usersById.containsKey(entry.getKey()))
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_PERFORMER_COUNT)
            .map(entry -> TopPerformer.builder()
                .userId(entry.getKey())
                .displayName(usersById.get(entry.getKey()).getDisplayName())
                .points(entry.getValue())
                .build())
            .toList();

        logger.debug("Calculated team stats over {} activities and {} users", activities.size(), users.size());

        return TeamStats.builder()
            .totalUsers(users.size())
            .totalPoints(totalPoints)
            .totalActivities(activities.size())
            .todayPoints(todayPoints)
            .todayActivities(todayActivities)
            .activeUsersToday(activeToday.size())
            .topPerformers(new ArrayList<>(topPerformers))
            .calculatedAt(clock.instant())
            .build();
    }

    Leaderboard calculateLeaderboard(LeaderboardPeriod period, LocalDate date) {
        LocalDate startDate = period.startOf(date);
        LocalDate endDate = period.endOf(date);

        List<Activity> activities = activityRepository.findByDateRange(null, startDate, endDate);
        Map<String, long[]> totalsByUser = new LinkedHashMap<>();
        for (Activity activity : activities) {
            long[] totals = totalsByUser.computeIfAbsent(activity.getUserId(), k -> new long[2]);
            totals[0] += activity.getPoints();
            totals[1]++;
        }

        List<LeaderboardEntry> entries = new ArrayList<>();
        for (Map.Entry<String, long[]> totals : totalsByUser.entrySet()) {
            Optional<User> user = userRepository.findById(totals.getKey());
            if (user.isEmpty()) {
                logger.debug("Skipping leaderboard participant {} without a user record", totals.getKey());
                continue;
            }
            entries.add(LeaderboardEntry.builder()
                .userId(totals.getKey())
                .displayName(user.get().getDisplayName())
                .pictureUrl(user.get().getPictureUrl())
                .points(totals.getValue()[0])
                .activities(totals.getValue()[1])
                .build());
        }

        List<LeaderboardEntry> ranked = rank(entries);

        return Leaderboard.builder()
            .period(period)
            .startDate(startDate)
            .endDate(endDate)
            .entries(ranked)
            .totalParticipants(ranked.size())
            .build();
    }

    private List<LeaderboardEntry> rank(List<LeaderboardEntry> entries) {
        List<LeaderboardEntry> sorted = entries.stream()
            .sorted(this::compareEntriesForRanking)
            .collect(Collectors.toCollection(ArrayList::new));
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setRank(i + 1);
        }
        return sorted;
    }

    private int compareEntriesForRanking(LeaderboardEntry a, LeaderboardEntry b) {
        int pointsCompare = Long.compare(b.getPoints(), a.getPoints());
        if (pointsCompare != 0) {
            return pointsCompare;
        }
        // Equal points rank by user id so the order does not depend on storage iteration order
        return Comparator.<String>naturalOrder().compare(a.getUserId(), b.getUserId());
    }
}
