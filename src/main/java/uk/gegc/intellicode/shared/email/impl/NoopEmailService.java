package uk.gegc.intellicode.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.intellicode.shared.email.EmailService;
import uk.gegc.intellicode.shared.util.EmailMasker;

/**
 * No-op email service for local development and testing. Logs what would have
 * been sent, including OTP codes, so the reset flow can be exercised without
 * a mail server.
 *
 * Activated when: app.email.provider=noop (the default)
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public void sendPasswordResetOtpEmail(String email, String firstName, String otpCode, long validityMinutes) {
        log.info("[NOOP] Would send password reset OTP to: {} (code {}, valid {} min)",
                EmailMasker.mask(email), otpCode, validityMinutes);
    }

    @Override
    public void sendPasswordResetConfirmationEmail(String email, String firstName) {
        log.info("[NOOP] Would send password reset confirmation to: {}", EmailMasker.mask(email));
    }
}
