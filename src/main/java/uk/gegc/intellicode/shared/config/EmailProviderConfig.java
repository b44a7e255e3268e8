package uk.gegc.intellicode.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import uk.gegc.intellicode.shared.email.EmailService;
import uk.gegc.intellicode.shared.email.impl.EmailServiceImpl;
import uk.gegc.intellicode.shared.email.impl.NoopEmailService;

/**
 * Selects the EmailService implementation from app.email.provider.
 * <ul>
 *   <li>smtp: Spring Mail over SMTP</li>
 *   <li>noop: log only (default)</li>
 * </ul>
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
    public EmailService smtpEmailService(JavaMailSender mailSender) {
        log.info("Activating SMTP email service");
        return new EmailServiceImpl(mailSender);
    }

    @Bean
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
