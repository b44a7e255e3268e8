package uk.gegc.intellicode.shared.email;

/**
 * Outbound mail. Delivery is best-effort: implementations log failures and
 * never throw to the caller.
 */
public interface EmailService {
    void sendPasswordResetOtpEmail(String email, String firstName, String otpCode, long validityMinutes);
    void sendPasswordResetConfirmationEmail(String email, String firstName);
}
