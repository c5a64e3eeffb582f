package com.salestracker.platform.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpsertUserRequest {
    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "displayName is required")
    private String displayName;

    private String pictureUrl;

    private String statusMessage;

    @Email(message = "email must be a valid address")
    private String email;
}
