package com.salestracker.platform.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chat command already decoded from a group webhook event, e.g. {@code /register}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupCommand {
    @NotBlank(message = "command is required")
    private String command;

    @NotBlank(message = "groupId is required")
    private String groupId;

    private String groupName;

    private String userId;
}
