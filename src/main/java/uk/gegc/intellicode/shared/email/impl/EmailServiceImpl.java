package uk.gegc.intellicode.shared.email.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import uk.gegc.intellicode.shared.email.EmailService;
import uk.gegc.intellicode.shared.util.EmailMasker;

/**
 * SMTP-based email service using Spring's JavaMailSender.
 * Activated when app.email.provider=smtp.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailServiceImpl implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @Value("${app.email.from-name:Intellicode}")
    private String fromName;

    @Value("${app.email.password-reset-otp.subject:Your Password Reset OTP Code}")
    private String otpSubject;

    @Value("${app.email.password-reset-confirmation.subject:Password Reset Successful}")
    private String confirmationSubject;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public void sendPasswordResetOtpEmail(String email, String firstName, String otpCode, long validityMinutes) {
        send(email, otpSubject, createOtpContent(firstName, otpCode, validityMinutes), "password reset OTP");
    }

    @Override
    public void sendPasswordResetConfirmationEmail(String email, String firstName) {
        send(email, confirmationSubject, createConfirmationContent(firstName), "password reset confirmation");
    }

    private void send(String to, String subject, String body, String description) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping {} email to: {}", description, EmailMasker.mask(to));
            return;
        }

        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromName + " <" + fromEmail + ">");
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);

            mailSender.send(message);
            log.info("Sent {} email to: {}", description, EmailMasker.mask(to));
        } catch (MailException e) {
            // delivery failures never reach the caller
            log.error("Failed to send {} email to: {}", description, EmailMasker.mask(to), e);
        }
    }

    private String createOtpContent(String firstName, String otpCode, long validityMinutes) {
        return String.format("""
            Hello %s,

            We received a request to reset your Intellicode password.
            Use the code below to continue:

                %s

            This code will expire in %d minutes.

            Never share this code with anyone. Intellicode will never ask you for it.
            If you did not request a password reset, you can ignore this email.

            The Intellicode Team
            """, greetingName(firstName), otpCode, validityMinutes);
    }

    private String createConfirmationContent(String firstName) {
        return String.format("""
            Hello %s,

            Your Intellicode password was changed successfully.
            You can now sign in with your new password.

            If you did not make this change, contact support immediately.

            The Intellicode Team
            """, greetingName(firstName));
    }

    private static String greetingName(String firstName) {
        return firstName == null || firstName.isBlank() ? "there" : firstName;
    }
}
