package uk.gegc.intellicode.features.auth.infra.identity;

import java.util.UUID;

/**
 * The system that owns user credentials.
 */
public interface IdentityProviderClient {

    /**
     * Replaces the user's password.
     *
     * @throws IdentityProviderException if the provider rejected the change or could not be reached
     */
    void updateCredential(UUID userId, String newPassword);
}
