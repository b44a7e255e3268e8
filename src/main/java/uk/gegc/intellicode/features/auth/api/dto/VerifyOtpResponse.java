package uk.gegc.intellicode.features.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "VerifyOtpResponse", description = "Reset token issued after a successful OTP verification")
public record VerifyOtpResponse(
        @Schema(description = "Token authorizing one password change")
        @JsonProperty("reset_token")
        String resetToken,

        @Schema(description = "Token lifetime in seconds", example = "900")
        @JsonProperty("expires_in")
        long expiresIn,

        @Schema(description = "Human readable message")
        String message
) {}
