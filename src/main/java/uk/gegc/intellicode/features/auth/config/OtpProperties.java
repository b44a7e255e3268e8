package uk.gegc.intellicode.features.auth.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.auth.otp")
public class OtpProperties {

    /**
     * How long an issued code can be verified.
     */
    @NotNull
    private Duration codeTtl = Duration.ofMinutes(10);

    /**
     * Trailing window in which OTP requests per email are counted.
     */
    @NotNull
    private Duration rateWindow = Duration.ofMinutes(15);

    @Min(1)
    private int maxRequestsPerWindow = 3;

    /**
     * Lifetime of the reset token handed out after a successful verification.
     */
    @NotNull
    private Duration resetTokenTtl = Duration.ofMinutes(15);

    /**
     * Base64 HMAC key used to sign reset tokens; at least 256 bits.
     */
    @NotBlank
    private String resetTokenSecret;
}
