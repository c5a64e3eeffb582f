package com.salestracker.platform.service;

import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.Group;
import com.salestracker.platform.repository.impl.JsonGroupRepository;
import com.salestracker.platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GroupServiceTest {

    @TempDir
    Path dataDirectory;

    private GroupService groupService;
    private final MutableClock clock = MutableClock.at("2024-03-10T03:00:00Z");

    @BeforeEach
    void setUp() {
        groupService = new GroupService(new JsonGroupRepository(dataDirectory.toString()), clock);
    }

    @Test
    void testRegisterGroup_EnablesNotifications() {
        Group group = groupService.registerGroup("g1", "Sales BKK", "u1");

        assertTrue(group.isNotificationsEnabled());
        assertEquals(clock.instant(), group.getCreatedAt());
        assertEquals(1, groupService.getAllGroups().size());
    }

    @Test
    void testRegisterGroup_AgainKeepsOriginalRegistration() {
        Instant registeredAt = clock.instant();
        groupService.registerGroup("g1", "Sales BKK", "u1");
        groupService.toggleNotifications("g1");
        clock.advance(Duration.ofDays(1));

        Group group = groupService.registerGroup("g1", null, "u2");

        assertTrue(group.isNotificationsEnabled());
        assertEquals("Sales BKK", group.getGroupName());
        assertEquals("u1", group.getRegisteredBy());
        assertEquals(registeredAt, group.getCreatedAt());
    }

    @Test
    void testToggleNotifications() {
        groupService.registerGroup("g1", "Sales BKK", "u1");

        assertEquals(false, groupService.toggleNotifications("g1").orElseThrow());
        assertEquals(true, groupService.toggleNotifications("g1").orElseThrow());
        assertTrue(groupService.toggleNotifications("unknown").isEmpty());
    }

    @Test
    void testRegisterGroup_RequiresId() {
        assertThrows(InvalidRequestException.class, () -> groupService.registerGroup(" ", "x", "u1"));
    }
}
