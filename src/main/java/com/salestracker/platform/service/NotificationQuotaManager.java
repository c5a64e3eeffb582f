package com.salestracker.platform.service;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.dto.QuotaDecision;
import com.salestracker.platform.dto.QuotaStats;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.QuotaRecord;
import com.salestracker.platform.repository.QuotaRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily send budget per message category. Counters are keyed by (category, day in the engine zone),
 * so a new day starts from zero without any reset job.
 * <p>
 * {@link #canSendMessage} is advisory. Callers that fan out use {@link #tryConsume} to reserve units
 * before sending, which keeps the counter within the ceiling under concurrent dispatchers.
 */
@Service
public class NotificationQuotaManager {

    private static final Logger logger = LoggerFactory.getLogger(NotificationQuotaManager.class);

    static final String REASON_NEARLY_EXHAUSTED = "Daily quota nearly exhausted";
    static final String REASON_EXHAUSTED = "Daily quota exhausted";

    private final QuotaRecordRepository quotaRecordRepository;
    private final SalesTrackerProperties properties;
    private final Clock clock;

    @Autowired
    public NotificationQuotaManager(QuotaRecordRepository quotaRecordRepository,
                                    SalesTrackerProperties properties,
                                    Clock clock) {
        this.quotaRecordRepository = quotaRecordRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public QuotaDecision canSendMessage(String category, boolean urgent) {
        SalesTrackerProperties.Policy policy = properties.getQuota().policyFor(category);
        long used = currentUsage(category, today());
        long remaining = Math.max(0, policy.getDailyLimit() - used);
        boolean warning = used >= policy.getWarningThreshold();
        boolean critical = used >= policy.getCriticalThreshold();

        QuotaDecision.QuotaDecisionBuilder decision = QuotaDecision.builder()
            .remaining(remaining)
            .warning(warning)
            .critical(critical);

        if (used >= policy.getDailyLimit()) {
            return decision.allowed(false).reason(REASON_EXHAUSTED).build();
        }
        if (critical && !urgent) {
            return decision.allowed(false).reason(REASON_NEARLY_EXHAUSTED).build();
        }
        return decision.allowed(true).build();
    }

    /**
     * Records {@code count} sends that already happened.
     *
     * @return remaining budget for today after the write
     */
    public long recordMessage(String category, String targetId, long count) {
        if (count <= 0) {
            throw new InvalidRequestException("count must be positive");
        }
        long used = quotaRecordRepository.increment(category, today(), count, targetId, clock.instant());
        long limit = properties.getQuota().policyFor(category).getDailyLimit();
        if (used >= properties.getQuota().policyFor(category).getWarningThreshold()) {
            logger.warn("Quota for {} at {}/{}", category, used, limit);
        }
        return Math.max(0, limit - used);
    }

    /**
     * Reserves {@code count} units if today's counter stays within the ceiling: the critical
     * threshold for regular sends, the daily limit for urgent ones.
     *
     * @return true when the units were reserved
     */
    public boolean tryConsume(String category, String targetId, long count, boolean urgent) {
        if (count <= 0) {
            throw new InvalidRequestException("count must be positive");
        }
        SalesTrackerProperties.Policy policy = properties.getQuota().policyFor(category);
        long ceiling = urgent ? policy.getDailyLimit() : policy.getCriticalThreshold();
        boolean granted = quotaRecordRepository.incrementIfWithin(
            category, today(), count, ceiling, targetId, clock.instant());
        if (!granted) {
            logger.warn("Quota ceiling {} reached for {}, refusing {} unit(s)", ceiling, category, count);
        }
        return granted;
    }

    /**
     * Returns units reserved by {@link #tryConsume} whose send failed.
     */
    public void release(String category, long count) {
        if (count <= 0) {
            return;
        }
        quotaRecordRepository.decrement(category, today(), count, clock.instant());
    }

    public QuotaStats getQuotaStats(String category) {
        LocalDate today = today();
        SalesTrackerProperties.Policy policy = properties.getQuota().policyFor(category);
        long used = currentUsage(category, today);
        long limit = policy.getDailyLimit();

        return QuotaStats.builder()
            .category(category)
            .date(today)
            .used(used)
            .limit(limit)
            .remaining(Math.max(0, limit - used))
            .percentage(limit > 0 ? (int) Math.round(used * 100.0 / limit) : 100)
            .warning(used >= policy.getWarningThreshold())
            .critical(used >= policy.getCriticalThreshold())
            .willResetAt(today.plusDays(1).atStartOfDay(clock.getZone()).toInstant())
            .build();
    }

    /**
     * Drops counters older than the retention window.
     *
     * @return number of records removed
     */
    public int cleanupOldRecords() {
        LocalDate cutoff = today().minusDays(properties.getQuota().getRetentionDays());
        int removed = quotaRecordRepository.deleteOlderThan(cutoff);
        logger.info("Removed {} quota records older than {}", removed, cutoff);
        return removed;
    }

    private long currentUsage(String category, LocalDate day) {
        return quotaRecordRepository.find(category, day)
            .map(QuotaRecord::getCount)
            .orElse(0L);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
