package com.salestracker.platform.service;

import com.salestracker.platform.dto.UpsertUserRequest;
import com.salestracker.platform.exception.UserNotFoundException;
import com.salestracker.platform.model.Streak;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.UserRepository;
import com.salestracker.platform.repository.impl.JsonUserRepository;
import com.salestracker.platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UserServiceTest {

    @TempDir
    Path dataDirectory;

    private JsonUserRepository userRepository;
    private UserService userService;
    private final MutableClock clock = MutableClock.at("2024-03-10T03:00:00Z");

    @BeforeEach
    void setUp() {
        userRepository = new JsonUserRepository(dataDirectory.toString());
        userService = new UserService(userRepository, clock);
    }

    @Test
    void testEnsureUser_CreatesPlaceholderOnce() {
        User first = userService.ensureUser("u1");
        User second = userService.ensureUser("u1");

        assertEquals("Unknown User", first.getDisplayName());
        assertSame(first, second);
        assertEquals(1, userRepository.count());
    }

    @Test
    void testCreateOrUpdateUser_UpdateKeepsTotals() {
        User placeholder = userService.ensureUser("u1");
        placeholder.setTotalPoints(120);
        userRepository.save(placeholder);
        clock.advance(Duration.ofMinutes(5));

        User updated = userService.createOrUpdateUser(
            new UpsertUserRequest("u1", "Somchai", "https://example.com/p.png", "Closing deals", null));

        assertEquals("Somchai", updated.getDisplayName());
        assertEquals(120, updated.getTotalPoints());
        assertEquals(clock.instant(), updated.getUpdatedAt());
        assertNotEquals(updated.getCreatedAt(), updated.getUpdatedAt());
    }

    @Test
    void testEnsureUser_ConcurrentFirstActivitiesCreateOneUser() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<User>> attempts = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                attempts.add(() -> userService.ensureUser("u1"));
            }

            for (Future<User> result : executor.invokeAll(attempts)) {
                assertEquals("u1", result.get().getUserId());
            }
            assertEquals(1, userRepository.count());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testEnsureUser_KeepsProfileWrittenFirst() {
        userService.createOrUpdateUser(new UpsertUserRequest("u1", "Somchai", null, null, "somchai@example.com"));

        User user = userService.ensureUser("u1");

        assertEquals("Somchai", user.getDisplayName());
        assertEquals("somchai@example.com", user.getEmail());
    }

    @Test
    void testCreateOrUpdateUser_ProfileUpdateLeavesTotalsAndStreak() {
        userService.ensureUser("u1");
        userRepository.updateTotals("u1", 450, 3, clock.instant(), clock.instant());
        userRepository.updateStreak("u1", new Streak(2, 5, LocalDate.of(2024, 3, 10)), clock.instant());

        User updated = userService.createOrUpdateUser(
            new UpsertUserRequest("u1", "Somchai", null, "On the road", null));

        assertEquals("Somchai", updated.getDisplayName());
        assertEquals(450, updated.getTotalPoints());
        assertEquals(3, updated.getTotalActivities());
        assertEquals(new Streak(2, 5, LocalDate.of(2024, 3, 10)), updated.getStreak());
    }

    @Test
    void testCreateOrUpdateUser_ExistingUserWritesOnlyProfileColumns() {
        UserRepository repository = mock(UserRepository.class);
        User stored = User.builder().userId("u1").displayName("Somchai").build();
        when(repository.insertIfAbsent(any())).thenReturn(false);
        when(repository.findById("u1")).thenReturn(Optional.of(stored));
        UserService service = new UserService(repository, clock);

        service.createOrUpdateUser(new UpsertUserRequest("u1", "Somchai K.", null, null, null));

        verify(repository).updateProfile("u1", "Somchai K.", null, null, null, clock.instant());
        verify(repository, never()).save(any());
    }

    @Test
    void testUpdateUserSettings_Merges() {
        userService.ensureUser("u1");
        userService.updateUserSettings("u1", Map.of("notifications", true));

        User user = userService.updateUserSettings("u1", Map.of("language", "th"));

        assertEquals(true, user.getSettings().get("notifications"));
        assertEquals("th", user.getSettings().get("language"));
    }

    @Test
    void testGetUser_Unknown() {
        assertThrows(UserNotFoundException.class, () -> userService.getUser("ghost"));
    }
}
