package com.salestracker.platform.service;

import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.Group;
import com.salestracker.platform.repository.GroupRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
public class GroupService {

    private static final Logger logger = LoggerFactory.getLogger(GroupService.class);

    private final GroupRepository groupRepository;
    private final Clock clock;

    @Autowired
    public GroupService(GroupRepository groupRepository, Clock clock) {
        this.groupRepository = groupRepository;
        this.clock = clock;
    }

    /**
     * Registers the group with notifications enabled. Re-registering keeps the original
     * registration and re-enables notifications.
     */
    public Group registerGroup(String groupId, String groupName, String registeredBy) {
        if (groupId == null || groupId.isBlank()) {
            throw new InvalidRequestException("groupId is required");
        }

        Optional<Group> existing = groupRepository.findById(groupId);
        if (existing.isPresent()) {
            Group group = existing.get();
            group.setNotificationsEnabled(true);
            if (groupName != null && !groupName.isBlank()) {
                group.setGroupName(groupName);
            }
            logger.info("Group {} registered again, notifications enabled", groupId);
            return groupRepository.save(group);
        }

        Group group = Group.builder()
            .groupId(groupId)
            .groupName(groupName)
            .registeredBy(registeredBy)
            .notificationsEnabled(true)
            .createdAt(clock.instant())
            .build();
        logger.info("Registered group {} by {}", groupId, registeredBy);
        return groupRepository.save(group);
    }

    /**
     * @return the new notification flag, or empty when the group is not registered
     */
    public Optional<Boolean> toggleNotifications(String groupId) {
        Optional<Group> existing = groupRepository.findById(groupId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Group group = existing.get();
        group.setNotificationsEnabled(!group.isNotificationsEnabled());
        groupRepository.save(group);
        logger.info("Notifications for group {} are now {}", groupId,
            group.isNotificationsEnabled() ? "enabled" : "disabled");
        return Optional.of(group.isNotificationsEnabled());
    }

    public Optional<Group> getGroup(String groupId) {
        return groupRepository.findById(groupId);
    }

    public List<Group> getAllGroups() {
        return groupRepository.findAll();
    }
}
