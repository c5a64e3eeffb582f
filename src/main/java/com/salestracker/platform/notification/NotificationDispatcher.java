package com.salestracker.platform.notification;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.dto.Leaderboard;
import com.salestracker.platform.dto.LeaderboardEntry;
import com.salestracker.platform.dto.QuotaDecision;
import com.salestracker.platform.dto.TeamStats;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.Group;
import com.salestracker.platform.model.LeaderboardPeriod;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.GroupRepository;
import com.salestracker.platform.repository.UserRepository;
import com.salestracker.platform.service.AggregationService;
import com.salestracker.platform.service.NotificationQuotaManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Fans a message out to every chat group with notifications enabled.
 * <p>
 * Each send first reserves one unit from the category quota. A refused reservation stops the loop,
 * a failed send gives its unit back. A failure for one group never affects the others.
 */
@Service
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final GroupRepository groupRepository;
    private final UserRepository userRepository;
    private final AggregationService aggregationService;
    private final NotificationQuotaManager quotaManager;
    private final ActivityNotificationBuilder messageBuilder;
    private final PushMessagingClient pushClient;
    private final SalesTrackerProperties properties;
    private final Clock clock;

    @Autowired
    public NotificationDispatcher(
            GroupRepository groupRepository,
            UserRepository userRepository,
            AggregationService aggregationService,
            NotificationQuotaManager quotaManager,
            ActivityNotificationBuilder messageBuilder,
            PushMessagingClient pushClient,
            SalesTrackerProperties properties,
            Clock clock) {
        this.groupRepository = groupRepository;
        this.userRepository = userRepository;
        this.aggregationService = aggregationService;
        this.quotaManager = quotaManager;
        this.messageBuilder = messageBuilder;
        this.pushClient = pushClient;
        this.properties = properties;
        this.clock = clock;
    }

    public FanOutResult dispatchActivity(Activity activity) {
        String category = properties.getNotifications().getActivityCategory();
        List<Group> groups = enabledGroups();
        if (groups.isEmpty()) {
            logger.debug("No groups with notifications enabled, skipping activity {}", activity.getActivityId());
            return FanOutResult.empty();
        }
        if (!quotaAllows(category, groups.size())) {
            return new FanOutResult(groups.size(), 0, 0, groups.size());
        }

        User user = userRepository.findById(activity.getUserId()).orElse(null);
        TeamStats teamStats = aggregationService.getTeamStats();
        LeaderboardEntry rank = aggregationService
            .getLeaderboard(LeaderboardPeriod.DAILY, LocalDate.now(clock))
            .findEntry(activity.getUserId())
            .orElse(null);

        PushMessage message = messageBuilder.buildActivityMessage(activity, user, rank, teamStats);
        return fanOut(category, groups, message);
    }

    /**
     * Posts the top of the daily leaderboard for {@code date} to every enabled group.
     */
    public FanOutResult broadcastDailyLeaderboard(LocalDate date) {
        String category = properties.getNotifications().getLeaderboardCategory();
        Leaderboard leaderboard = aggregationService.getLeaderboard(LeaderboardPeriod.DAILY, date);
        if (leaderboard.getEntries().isEmpty()) {
            logger.info("No activities on {}, skipping leaderboard broadcast", date);
            return FanOutResult.empty();
        }

        List<Group> groups = enabledGroups();
        if (groups.isEmpty() || !quotaAllows(category, groups.size())) {
            return new FanOutResult(groups.size(), 0, 0, groups.size());
        }

        PushMessage message = messageBuilder.buildLeaderboardMessage(
            leaderboard, properties.getNotifications().getLeaderboardSize());
        return fanOut(category, groups, message);
    }

    private List<Group> enabledGroups() {
        return groupRepository.findAll().stream()
            .filter(Group::isNotificationsEnabled)
            .toList();
    }

    private boolean quotaAllows(String category, int groupCount) {
        QuotaDecision decision = quotaManager.canSendMessage(category, false);
        if (!decision.isAllowed()) {
            logger.warn("Skipping {} notification to {} groups: {}", category, groupCount, decision.getReason());
            return false;
        }
        if (decision.isWarning()) {
            logger.warn("Quota for {} is running low: {} messages remaining today", category, decision.getRemaining());
        }
        return true;
    }

    private FanOutResult fanOut(String category, List<Group> groups, PushMessage message) {
        int sent = 0;
        int failed = 0;
        int suppressed = 0;

        for (int i = 0; i < groups.size(); i++) {
            Group group = groups.get(i);
            if (!quotaManager.tryConsume(category, group.getGroupId(), 1, false)) {
                suppressed = groups.size() - i;
                logger.warn("Quota reached for {}, {} groups not notified", category, suppressed);
                break;
            }
            try {
                pushClient.send(group.getGroupId(), message);
                sent++;
            } catch (PushDeliveryException | RuntimeException e) {
                failed++;
                quotaManager.release(category, 1);
                logger.error("Failed to notify group {}", group.getGroupId(), e);
            }
        }

        logger.info("Fan-out of {} finished: {} sent, {} failed, {} suppressed", category, sent, failed, suppressed);
        return new FanOutResult(groups.size(), sent, failed, suppressed);
    }
}
