package com.salestracker.platform.scheduling;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.service.CacheService;
import com.salestracker.platform.service.NotificationQuotaManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic sweeps for expired cache entries and old quota counters. Each sweep is held as a
 * cancellable handle so it can be stopped or restarted without restarting the process.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    public static final String CACHE_CLEANUP = "cache-cleanup";
    public static final String QUOTA_CLEANUP = "quota-cleanup";

    private final TaskScheduler taskScheduler;
    private final Map<String, Sweep> sweeps = new LinkedHashMap<>();
    private final Map<String, ScheduledFuture<?>> handles = new ConcurrentHashMap<>();

    @Autowired
    public MaintenanceScheduler(TaskScheduler taskScheduler,
                                CacheService cacheService,
                                NotificationQuotaManager quotaManager,
                                SalesTrackerProperties properties) {
        this.taskScheduler = taskScheduler;
        sweeps.put(CACHE_CLEANUP, new Sweep(cacheService::cleanupExpired, properties.getCache().getCleanupInterval()));
        sweeps.put(QUOTA_CLEANUP, new Sweep(quotaManager::cleanupOldRecords, properties.getQuota().getCleanupInterval()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        sweeps.keySet().forEach(this::start);
    }

    @PreDestroy
    public void stopAll() {
        sweeps.keySet().forEach(this::cancel);
    }

    public synchronized void start(String name) {
        Sweep sweep = sweeps.get(name);
        if (sweep == null) {
            throw new IllegalArgumentException("Unknown maintenance task: " + name);
        }
        if (isRunning(name)) {
            return;
        }
        handles.put(name, taskScheduler.scheduleAtFixedRate(() -> runSweep(name, sweep), sweep.interval));
        logger.info("Scheduled {} every {}", name, sweep.interval);
    }

    /**
     * @return true if a running sweep was cancelled
     */
    public synchronized boolean cancel(String name) {
        ScheduledFuture<?> handle = handles.remove(name);
        if (handle == null) {
            return false;
        }
        handle.cancel(false);
        logger.info("Cancelled {}", name);
        return true;
    }

    public synchronized void restart(String name) {
        cancel(name);
        start(name);
    }

    public boolean isRunning(String name) {
        ScheduledFuture<?> handle = handles.get(name);
        return handle != null && !handle.isCancelled();
    }

    public Set<String> taskNames() {
        return sweeps.keySet();
    }

    private void runSweep(String name, Sweep sweep) {
        try {
            int removed = sweep.task.run();
            logger.debug("{} removed {} records", name, removed);
        } catch (Exception e) {
            logger.error("Error running {}", name, e);
        }
    }

    @FunctionalInterface
    private interface SweepTask {
        int run();
    }

    private static final class Sweep {
        private final SweepTask task;
        private final Duration interval;

        private Sweep(SweepTask task, Duration interval) {
            this.task = task;
            this.interval = interval;
        }
    }
}
