package uk.gegc.intellicode.features.auth.application;

import uk.gegc.intellicode.features.auth.api.dto.MessageResponse;
import uk.gegc.intellicode.features.auth.api.dto.VerifyOtpResponse;
import uk.gegc.intellicode.features.auth.domain.service.PasswordResetFailure;
import uk.gegc.intellicode.shared.result.Result;

/**
 * Email OTP based password reset: request a code, trade it for a reset token,
 * spend the token on a new password.
 */
public interface PasswordResetService {

    /**
     * Issues a code if the email belongs to a user. The response is the same
     * whether or not the account exists.
     */
    Result<MessageResponse, PasswordResetFailure> requestOtp(String email);

    Result<VerifyOtpResponse, PasswordResetFailure> verifyOtp(String email, String otpCode);

    Result<MessageResponse, PasswordResetFailure> resetPassword(String resetToken, String newPassword);
}
