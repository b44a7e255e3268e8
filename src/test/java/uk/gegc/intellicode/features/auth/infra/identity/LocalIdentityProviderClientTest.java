package uk.gegc.intellicode.features.auth.infra.identity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import uk.gegc.intellicode.BaseUnitTest;
import uk.gegc.intellicode.features.user.domain.model.User;
import uk.gegc.intellicode.features.user.domain.model.UserRole;
import uk.gegc.intellicode.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LocalIdentityProviderClientTest extends BaseUnitTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private UserRepository userRepository;

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private LocalIdentityProviderClient client;
    private User user;

    @BeforeEach
    void setUp() {
        client = new LocalIdentityProviderClient(userRepository, passwordEncoder, CLOCK);
        user = new User(UUID.randomUUID(), "ann@example.com", "Ann", "Lee", UserRole.STUDENT,
                null, null, null, false);
    }

    @Test
    @DisplayName("stores a BCrypt hash and stamps the change time")
    void updatesCredential() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

        client.updateCredential(user.getId(), "N3w-Passw0rd!");

        assertThat(user.getHashedPassword()).isNotEqualTo("N3w-Passw0rd!");
        assertThat(passwordEncoder.matches("N3w-Passw0rd!", user.getHashedPassword())).isTrue();
        assertThat(user.getPasswordChangedAt()).isEqualTo(LocalDateTime.of(2025, 3, 1, 10, 0));
        verify(userRepository).save(user);
    }

    @Test
    @DisplayName("database failure is raised as a provider failure")
    void databaseFailure() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> client.updateCredential(user.getId(), "N3w-Passw0rd!"))
                .isInstanceOf(IdentityProviderException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("unknown user is a provider failure")
    void unknownUser() {
        UUID missing = UUID.randomUUID();
        when(userRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> client.updateCredential(missing, "N3w-Passw0rd!"))
                .isInstanceOf(IdentityProviderException.class);
    }
}
