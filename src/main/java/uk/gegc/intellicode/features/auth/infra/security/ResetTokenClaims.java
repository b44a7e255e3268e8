package uk.gegc.intellicode.features.auth.infra.security;

import java.time.Instant;
import java.util.UUID;

/**
 * Verified content of a reset token.
 *
 * @param passwordVersion epoch millis of the user's password change at issuance, 0 if never changed
 */
public record ResetTokenClaims(UUID userId, String tokenId, Instant issuedAt, Instant expiresAt, long passwordVersion) {
}
