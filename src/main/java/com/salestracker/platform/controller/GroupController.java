package com.salestracker.platform.controller;

import com.salestracker.platform.dto.GroupCommand;
import com.salestracker.platform.model.Group;
import com.salestracker.platform.service.GroupCommandHandler;
import com.salestracker.platform.service.GroupService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/groups")
public class GroupController {

    private static final Logger logger = LoggerFactory.getLogger(GroupController.class);

    private final GroupService groupService;
    private final GroupCommandHandler commandHandler;

    @Autowired
    public GroupController(GroupService groupService, GroupCommandHandler commandHandler) {
        this.groupService = groupService;
        this.commandHandler = commandHandler;
    }

    /**
     * Receives a command already decoded from a chat webhook event and returns the reply text.
     */
    @PostMapping("/commands")
    public ResponseEntity<Map<String, String>> handleCommand(@Valid @RequestBody GroupCommand command) {
        logger.info("Received group command {} from group {}", command.getCommand(), command.getGroupId());
        return ResponseEntity.ok(Map.of("reply", commandHandler.handle(command)));
    }

    @GetMapping
    public ResponseEntity<List<Group>> getAllGroups() {
        logger.info("Received GET request for groups");
        return ResponseEntity.ok(groupService.getAllGroups());
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<Group> getGroup(@PathVariable String groupId) {
        return groupService.getGroup(groupId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
