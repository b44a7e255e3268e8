package uk.gegc.intellicode.features.auth.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.intellicode.features.auth.api.dto.*;
import uk.gegc.intellicode.features.auth.application.PasswordResetService;
import uk.gegc.intellicode.features.auth.domain.service.PasswordResetFailure;

@Tag(name = "Password reset", description = "Email OTP based password reset")
@RestController
@RequestMapping("/api/v1/auth/password-reset")
@RequiredArgsConstructor
public class PasswordResetController {

    private final PasswordResetService passwordResetService;

    @Operation(summary = "Request a reset code",
            description = "Always answers with the same message, whether or not the email is registered.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request accepted",
                    content = @Content(schema = @Schema(implementation = MessageResponse.class))),
            @ApiResponse(responseCode = "429", description = "Too many codes requested recently",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/request")
    public ResponseEntity<MessageResponse> requestOtp(@RequestBody @Valid RequestOtpRequest request) {
        return ResponseEntity.ok(passwordResetService.requestOtp(request.email())
                .orElseThrow(PasswordResetFailure::toException));
    }

    @Operation(summary = "Verify a reset code and obtain a reset token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code accepted",
                    content = @Content(schema = @Schema(implementation = VerifyOtpResponse.class))),
            @ApiResponse(responseCode = "400", description = "Malformed, wrong, expired or already used code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/verify")
    public ResponseEntity<VerifyOtpResponse> verifyOtp(@RequestBody @Valid VerifyOtpRequest request) {
        return ResponseEntity.ok(passwordResetService.verifyOtp(request.email(), request.otpCode())
                .orElseThrow(PasswordResetFailure::toException));
    }

    @Operation(summary = "Set a new password with a reset token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed",
                    content = @Content(schema = @Schema(implementation = MessageResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid or expired token, or weak password",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "User no longer exists",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Identity provider unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reset")
    public ResponseEntity<MessageResponse> resetPassword(@RequestBody @Valid ResetPasswordRequest request) {
        return ResponseEntity.ok(passwordResetService.resetPassword(request.resetToken(), request.newPassword())
                .orElseThrow(PasswordResetFailure::toException));
    }
}
