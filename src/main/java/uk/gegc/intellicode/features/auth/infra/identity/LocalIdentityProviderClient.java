package uk.gegc.intellicode.features.auth.infra.identity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.user.domain.model.User;
import uk.gegc.intellicode.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Keeps credentials on the local user row as BCrypt hashes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalIdentityProviderClient implements IdentityProviderClient {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    public void updateCredential(UUID userId, String newPassword) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new IdentityProviderException("Unknown user " + userId));
        try {
            user.setHashedPassword(passwordEncoder.encode(newPassword));
            user.setPasswordChangedAt(LocalDateTime.now(utcClock));
            userRepository.save(user);
        } catch (DataAccessException ex) {
            throw new IdentityProviderException("Failed to store new credential for user " + userId, ex);
        }
        log.debug("Credential updated for user {}", userId);
    }
}
