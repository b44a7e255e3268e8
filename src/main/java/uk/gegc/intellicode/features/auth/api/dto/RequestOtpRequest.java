package uk.gegc.intellicode.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "RequestOtpRequest", description = "Request a password reset code by email")
public record RequestOtpRequest(
        @Schema(description = "Account email", example = "student@example.com")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email
) {}
