package com.salestracker.platform.service;

import com.salestracker.platform.dto.GroupCommand;
import com.salestracker.platform.model.Group;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Handles the slash commands members type in a chat group and returns the reply text.
 */
@Service
public class GroupCommandHandler {

    private static final Logger logger = LoggerFactory.getLogger(GroupCommandHandler.class);

    static final String NOT_REGISTERED_REPLY = "This group is not registered. Send /register first.";

    private final GroupService groupService;

    @Autowired
    public GroupCommandHandler(GroupService groupService) {
        this.groupService = groupService;
    }

    public String handle(GroupCommand command) {
        String name = command.getCommand() == null ? "" : command.getCommand().trim().toLowerCase(Locale.ROOT);
        logger.info("Group {} sent {}", command.getGroupId(), name);

        switch (name) {
            case "/register":
                Group group = groupService.registerGroup(
                    command.getGroupId(), command.getGroupName(), command.getUserId());
                return "Group registered. Activity notifications are on for "
                    + (group.getGroupName() != null ? group.getGroupName() : "this group") + ".";
            case "/toggle":
                return groupService.toggleNotifications(command.getGroupId())
                    .map(enabled -> enabled ? "Notifications enabled." : "Notifications disabled.")
                    .orElse(NOT_REGISTERED_REPLY);
            case "/status":
                Optional<Group> existing = groupService.getGroup(command.getGroupId());
                if (existing.isEmpty()) {
                    return NOT_REGISTERED_REPLY;
                }
                return "Notifications are " + (existing.get().isNotificationsEnabled() ? "enabled" : "disabled") + ".";
            default:
                return "Unknown command. Available commands: /register, /toggle, /status";
        }
    }
}
