package uk.gegc.intellicode.features.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.intellicode.shared.validation.ValidPassword;

@Schema(name = "ResetPasswordRequest", description = "Set a new password using a reset token")
public record ResetPasswordRequest(
        @Schema(description = "Token returned by OTP verification")
        @JsonProperty("reset_token")
        @NotBlank(message = "Reset token is required")
        String resetToken,

        @Schema(description = "New password", example = "NewP@ssw0rd!")
        @JsonProperty("new_password")
        @NotBlank(message = "Password is required")
        @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
        @ValidPassword
        String newPassword
) {}
