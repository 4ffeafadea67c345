package com.minicrm.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User response DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "User details response")
public class UserResponse {

    @Schema(description = "User ID")
    private String id;

    @Schema(description = "User email")
    private String email;

    @Schema(description = "User display name")
    private String name;

    @Schema(description = "Avatar URL")
    private String avatarUrl;

    @Schema(description = "OAuth provider (google)")
    private String oauthProvider;

    @Schema(description = "Account creation date")
    private Instant createdAt;

    @Schema(description = "Last sign-in")
    private Instant lastLoginAt;
}
