package com.salestracker.platform.service;

import com.salestracker.platform.dto.CreateActivityRequest;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.exception.SalesTrackerException;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.ActivityType;
import com.salestracker.platform.model.DeleteOutcome;
import com.salestracker.platform.repository.ActivityRepository;
import com.salestracker.platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActivityServiceTest {

    @Mock
    private ActivityRepository activityRepository;

    @Mock
    private UserService userService;

    @Mock
    private UserStatsService userStatsService;

    @Mock
    private AggregationService aggregationService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ActivityService activityService;

    // 2024-03-10 in Bangkok, still 2024-03-09 in UTC
    private final MutableClock clock = MutableClock.at("2024-03-09T20:00:00Z");

    @BeforeEach
    void setUp() {
        activityService = new ActivityService(activityRepository, userService, userStatsService,
            aggregationService, eventPublisher, clock);
    }

    private CreateActivityRequest request(int points) {
        return CreateActivityRequest.builder()
            .userId("u1")
            .activityType(ActivityType.MEETING)
            .title("  Client meeting ")
            .points(points)
            .build();
    }

    @Test
    void testCreateActivity_StoresEvictsAndPublishes() {
        // Arrange
        when(activityRepository.save(any(Activity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        Activity activity = activityService.createActivity(request(50));

        // Assert
        assertNotNull(activity.getActivityId());
        assertEquals("Client meeting", activity.getTitle());
        assertEquals(LocalDate.of(2024, 3, 10), activity.getDate());
        assertEquals(clock.instant(), activity.getCreatedAt());
        verify(userService).ensureUser("u1");
        verify(aggregationService).evictFor(LocalDate.of(2024, 3, 10));

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertSame(activity, ((ActivityCreatedEvent) event.getValue()).getActivity());
    }

    @Test
    void testCreateActivity_PointBoundariesAccepted() {
        when(activityRepository.save(any(Activity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertEquals(0, activityService.createActivity(request(0)).getPoints());
        assertEquals(1000, activityService.createActivity(request(1000)).getPoints());
    }

    @Test
    void testCreateActivity_PointsOutOfRangeRejected() {
        assertThrows(InvalidRequestException.class, () -> activityService.createActivity(request(-1)));
        assertThrows(InvalidRequestException.class, () -> activityService.createActivity(request(1001)));

        verifyNoInteractions(activityRepository, eventPublisher, aggregationService);
    }

    @Test
    void testCreateActivity_MissingFieldsRejected() {
        CreateActivityRequest noTitle = request(10);
        noTitle.setTitle(" ");
        CreateActivityRequest noType = request(10);
        noType.setActivityType(null);

        assertThrows(InvalidRequestException.class, () -> activityService.createActivity(noTitle));
        assertThrows(InvalidRequestException.class, () -> activityService.createActivity(noType));
        assertThrows(InvalidRequestException.class, () -> activityService.createActivity(null));
    }

    @Test
    void testCreateActivity_ExplicitDateKept() {
        when(activityRepository.save(any(Activity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        CreateActivityRequest backdated = request(10);
        backdated.setDate(LocalDate.of(2024, 2, 1));

        Activity activity = activityService.createActivity(backdated);

        assertEquals(LocalDate.of(2024, 2, 1), activity.getDate());
        verify(aggregationService).evictFor(LocalDate.of(2024, 2, 1));
    }

    @Test
    void testCreateActivity_StorageFailureNotPublished() {
        when(activityRepository.save(any(Activity.class))).thenThrow(new RuntimeException("disk full"));

        assertThrows(SalesTrackerException.class, () -> activityService.createActivity(request(10)));

        verifyNoInteractions(eventPublisher, aggregationService);
    }

    @Test
    void testDeleteActivity_UnknownIdIsNotFound() {
        when(activityRepository.findById("missing")).thenReturn(Optional.empty());

        assertEquals(DeleteOutcome.NOT_FOUND, activityService.deleteActivity("missing"));

        verify(activityRepository, never()).deleteById(anyString());
        verifyNoInteractions(aggregationService, userStatsService);
    }

    @Test
    void testDeleteActivity_RefreshesOwnerAndCaches() {
        Activity stored = Activity.builder()
            .activityId("a1")
            .userId("u1")
            .points(10)
            .date(LocalDate.of(2024, 3, 8))
            .build();
        when(activityRepository.findById("a1")).thenReturn(Optional.of(stored));

        assertEquals(DeleteOutcome.DELETED, activityService.deleteActivity("a1"));

        verify(activityRepository).deleteById("a1");
        verify(aggregationService).evictFor(LocalDate.of(2024, 3, 8));
        verify(userStatsService).refreshUserStats("u1");
    }

    @Test
    void testGetActivitiesByDateRange_RejectsInvertedRange() {
        assertThrows(InvalidRequestException.class, () -> activityService.getActivitiesByDateRange(
            null, LocalDate.of(2024, 3, 10), LocalDate.of(2024, 3, 1)));
    }

    @Test
    void testGetUserActivities_CappedAtHundred() {
        activityService.getUserActivities("u1", null);
        activityService.getUserActivities("u1", LocalDate.of(2024, 3, 10));

        verify(activityRepository).findByUserId("u1", 100);
        verify(activityRepository).findByUserIdAndDate("u1", LocalDate.of(2024, 3, 10), 100);
    }
}
