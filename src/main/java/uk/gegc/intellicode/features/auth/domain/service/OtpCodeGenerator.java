package uk.gegc.intellicode.features.auth.domain.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class OtpCodeGenerator {

    static final int MIN_CODE = 100_000;
    static final int MAX_CODE = 999_999;

    private final SecureRandom random = new SecureRandom();

    /**
     * Six digit code drawn uniformly from [100000, 999999].
     */
    public String generate() {
        return String.valueOf(MIN_CODE + random.nextInt(MAX_CODE - MIN_CODE + 1));
    }
}
