package com.salestracker.platform.scheduling;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.service.CacheService;
import com.salestracker.platform.service.NotificationQuotaManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private CacheService cacheService;

    @Mock
    private NotificationQuotaManager quotaManager;

    @Mock
    private ScheduledFuture<Object> cacheHandle;

    @Mock
    private ScheduledFuture<Object> quotaHandle;

    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new MaintenanceScheduler(taskScheduler, cacheService, quotaManager, new SalesTrackerProperties());
    }

    @Test
    void testStartAll_SchedulesBothSweepsAtConfiguredIntervals() {
        doReturn(cacheHandle).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(10)));
        doReturn(quotaHandle).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofHours(6)));

        scheduler.startAll();

        assertTrue(scheduler.isRunning(MaintenanceScheduler.CACHE_CLEANUP));
        assertTrue(scheduler.isRunning(MaintenanceScheduler.QUOTA_CLEANUP));
    }

    @Test
    void testCancel_StopsOnlyThatSweep() {
        doReturn(cacheHandle).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(10)));
        doReturn(quotaHandle).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofHours(6)));
        scheduler.startAll();

        assertTrue(scheduler.cancel(MaintenanceScheduler.CACHE_CLEANUP));

        verify(cacheHandle).cancel(false);
        verify(quotaHandle, never()).cancel(anyBoolean());
        assertFalse(scheduler.isRunning(MaintenanceScheduler.CACHE_CLEANUP));
        assertTrue(scheduler.isRunning(MaintenanceScheduler.QUOTA_CLEANUP));
        assertFalse(scheduler.cancel(MaintenanceScheduler.CACHE_CLEANUP));
    }

    @Test
    void testRestart_ReplacesHandle() {
        doReturn(cacheHandle).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(10)));

        scheduler.start(MaintenanceScheduler.CACHE_CLEANUP);
        scheduler.restart(MaintenanceScheduler.CACHE_CLEANUP);

        verify(cacheHandle).cancel(false);
        verify(taskScheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(10)));
    }

    @Test
    void testSweepFailureIsContained() {
        doReturn(cacheHandle).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(10)));
        when(cacheService.cleanupExpired()).thenThrow(new RuntimeException("storage down"));
        scheduler.start(MaintenanceScheduler.CACHE_CLEANUP);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(task.capture(), eq(Duration.ofMinutes(10)));

        assertDoesNotThrow(() -> task.getValue().run());
        verify(cacheService).cleanupExpired();
    }

    @Test
    void testStart_UnknownTask() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.start("reindex"));
    }
}
