package uk.gegc.intellicode.features.auth.infra.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.auth.config.OtpProperties;
import uk.gegc.intellicode.features.user.domain.model.User;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Signs and verifies the short-lived token that authorizes one password change
 * after an OTP was verified. Tokens are HMAC-signed JWTs with a dedicated type
 * claim so access tokens cannot be replayed here and vice versa.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResetTokenService {

    static final String TYPE_CLAIM = "type";
    static final String RESET_TYPE = "password_reset";
    static final String PASSWORD_VERSION_CLAIM = "pwdChangedAt";

    private final OtpProperties otpProperties;
    @Qualifier("utcClock")
    private final Clock utcClock;

    private SecretKey key;

    @PostConstruct
    public void init() {
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(otpProperties.getResetTokenSecret()));
    }

    public String issue(User user) {
        Instant now = utcClock.instant();
        Instant expiry = now.plus(otpProperties.getResetTokenTtl());

        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(TYPE_CLAIM, RESET_TYPE)
                .claim(PASSWORD_VERSION_CLAIM, passwordVersion(user.getPasswordChangedAt()))
                .signWith(key)
                .compact();
    }

    public long ttlSeconds() {
        return otpProperties.getResetTokenTtl().toSeconds();
    }

    /**
     * Returns the claims of a genuine, unexpired reset token, or empty for
     * anything else.
     */
    public Optional<ResetTokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(utcClock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("Reset token is expired: {}", ex.getMessage());
            return Optional.empty();
        } catch (SignatureException ex) {
            log.warn("Reset token with invalid signature rejected");
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Malformed reset token rejected: {}", ex.getMessage());
            return Optional.empty();
        }

        if (!RESET_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
            log.warn("Token of type '{}' presented as reset token", claims.get(TYPE_CLAIM, String.class));
            return Optional.empty();
        }
        Long passwordVersion = claims.get(PASSWORD_VERSION_CLAIM, Long.class);
        if (passwordVersion == null || claims.getSubject() == null
                || claims.getIssuedAt() == null || claims.getExpiration() == null) {
            log.warn("Reset token missing required claims");
            return Optional.empty();
        }

        UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException ex) {
            log.warn("Reset token subject is not a user id");
            return Optional.empty();
        }

        return Optional.of(new ResetTokenClaims(
                userId,
                claims.getId(),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant(),
                passwordVersion));
    }

    /**
     * Whether the user's password is still the one the token was issued against.
     */
    public boolean isCurrentFor(ResetTokenClaims claims, User user) {
        return passwordVersion(user.getPasswordChangedAt()) <= claims.passwordVersion();
    }

    private static long passwordVersion(LocalDateTime passwordChangedAt) {
        return passwordChangedAt == null ? 0L : passwordChangedAt.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
