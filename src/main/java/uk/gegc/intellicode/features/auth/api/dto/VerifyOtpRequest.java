package uk.gegc.intellicode.features.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Schema(name = "VerifyOtpRequest", description = "Verify a password reset code")
public record VerifyOtpRequest(
        @Schema(description = "Account email", example = "student@example.com")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Schema(description = "Six digit code from the email", example = "482913")
        @JsonProperty("otp_code")
        @NotBlank(message = "OTP code is required")
        @Pattern(regexp = "^[0-9]{6}$", message = "OTP code must be exactly 6 digits")
        String otpCode
) {}
