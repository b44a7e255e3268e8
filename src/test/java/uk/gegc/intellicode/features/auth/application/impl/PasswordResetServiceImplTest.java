package uk.gegc.intellicode.features.auth.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.intellicode.BaseUnitTest;
import uk.gegc.intellicode.features.auth.api.dto.MessageResponse;
import uk.gegc.intellicode.features.auth.api.dto.VerifyOtpResponse;
import uk.gegc.intellicode.features.auth.config.OtpProperties;
import uk.gegc.intellicode.features.auth.domain.model.PasswordResetOtp;
import uk.gegc.intellicode.features.auth.domain.repository.PasswordResetOtpRepository;
import uk.gegc.intellicode.features.auth.domain.service.OtpCodeGenerator;
import uk.gegc.intellicode.features.auth.domain.service.PasswordResetError;
import uk.gegc.intellicode.features.auth.domain.service.PasswordResetFailure;
import uk.gegc.intellicode.features.auth.infra.identity.IdentityProviderClient;
import uk.gegc.intellicode.features.auth.infra.identity.IdentityProviderException;
import uk.gegc.intellicode.features.auth.infra.security.ResetTokenClaims;
import uk.gegc.intellicode.features.auth.infra.security.ResetTokenService;
import uk.gegc.intellicode.features.user.domain.model.User;
import uk.gegc.intellicode.features.user.domain.model.UserRole;
import uk.gegc.intellicode.features.user.domain.repository.UserRepository;
import uk.gegc.intellicode.shared.email.EmailService;
import uk.gegc.intellicode.shared.exception.RateLimitExceededException;
import uk.gegc.intellicode.shared.result.Result;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PasswordResetServiceImplTest extends BaseUnitTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private UserRepository userRepository;
    @Mock
    private PasswordResetOtpRepository otpRepository;
    @Mock
    private OtpCodeGenerator codeGenerator;
    @Mock
    private ResetTokenService resetTokenService;
    @Mock
    private IdentityProviderClient identityProviderClient;
    @Mock
    private EmailService emailService;

    private PasswordResetServiceImpl service;
    private User user;

    @BeforeEach
    void setUp() {
        OtpProperties properties = new OtpProperties();
        properties.setResetTokenSecret("unused");
        service = new PasswordResetServiceImpl(userRepository, otpRepository, codeGenerator, resetTokenService,
                identityProviderClient, emailService, properties, CLOCK);

        user = new User(UUID.randomUUID(), "ann@example.com", "Ann", "Lee", UserRole.STUDENT,
                null, null, NOW.minusYears(1), false);
    }

    @Nested
    class Request {

        @Test
        @DisplayName("known and unknown emails get the same response")
        void sameResponseForUnknownEmail() {
            when(userRepository.findByEmailIgnoreCase("ann@example.com")).thenReturn(Optional.of(user));
            when(userRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());
            when(codeGenerator.generate()).thenReturn("123456");

            Result<MessageResponse, PasswordResetFailure> known = service.requestOtp("Ann@Example.com ");
            Result<MessageResponse, PasswordResetFailure> unknown = service.requestOtp("ghost@example.com");

            assertThat(known.getValue()).isEqualTo(unknown.getValue());
            assertThat(known.getValue().message())
                    .isEqualTo("If an account with that email exists, a password reset code has been sent.");
            verify(otpRepository, times(1)).save(any(PasswordResetOtp.class));
            verify(emailService, times(1)).sendPasswordResetOtpEmail(anyString(), anyString(), anyString(), anyLong());
        }

        @Test
        @DisplayName("issues a fresh code after invalidating outstanding ones")
        void issuesCode() {
            when(userRepository.findByEmailIgnoreCase("ann@example.com")).thenReturn(Optional.of(user));
            when(otpRepository.countByEmailAndCreatedAtAfter("ann@example.com", NOW.minusMinutes(15))).thenReturn(2L);
            when(codeGenerator.generate()).thenReturn("654321");

            service.requestOtp("ann@example.com");

            ArgumentCaptor<PasswordResetOtp> saved = ArgumentCaptor.forClass(PasswordResetOtp.class);
            var order = inOrder(otpRepository);
            order.verify(otpRepository).invalidateUserOtps(user.getId());
            order.verify(otpRepository).save(saved.capture());
            assertThat(saved.getValue().getOtpCode()).isEqualTo("654321");
            assertThat(saved.getValue().getUserId()).isEqualTo(user.getId());
            assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
            assertThat(saved.getValue().getExpiresAt()).isEqualTo(NOW.plusMinutes(10));
            assertThat(saved.getValue().isUsed()).isFalse();
            verify(emailService).sendPasswordResetOtpEmail("ann@example.com", "Ann", "654321", 10L);
        }

        @Test
        @DisplayName("fourth request within the window is rate limited and creates nothing")
        void rateLimited() {
            PasswordResetOtp oldest = new PasswordResetOtp();
            oldest.setCreatedAt(NOW.minusMinutes(5));
            when(userRepository.findByEmailIgnoreCase("ann@example.com")).thenReturn(Optional.of(user));
            when(otpRepository.countByEmailAndCreatedAtAfter("ann@example.com", NOW.minusMinutes(15))).thenReturn(3L);
            when(otpRepository.findFirstByEmailAndCreatedAtAfterOrderByCreatedAtAsc("ann@example.com", NOW.minusMinutes(15)))
                    .thenReturn(Optional.of(oldest));

            Result<MessageResponse, PasswordResetFailure> result = service.requestOtp("ann@example.com");

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.RATE_LIMITED);
            assertThat(result.getError().retryAfterSeconds()).isEqualTo(600);
            assertThat(result.getError().toException()).isInstanceOf(RateLimitExceededException.class);
            verify(otpRepository, never()).save(any());
            verify(otpRepository, never()).invalidateUserOtps(any());
            verifyNoInteractions(emailService);
        }

        @Test
        @DisplayName("email failure does not fail the request")
        void emailFailureIsNotFatal() {
            when(userRepository.findByEmailIgnoreCase("ann@example.com")).thenReturn(Optional.of(user));
            when(codeGenerator.generate()).thenReturn("111111");
            doThrow(new IllegalStateException("smtp down")).when(emailService)
                    .sendPasswordResetOtpEmail(anyString(), anyString(), anyString(), anyLong());

            Result<MessageResponse, PasswordResetFailure> result = service.requestOtp("ann@example.com");

            assertThat(result.isOk()).isTrue();
            verify(otpRepository).save(any(PasswordResetOtp.class));
        }
    }

    @Nested
    class Verify {

        private PasswordResetOtp otp;

        @BeforeEach
        void setUp() {
            otp = new PasswordResetOtp();
            otp.setId(UUID.randomUUID());
            otp.setUserId(user.getId());
            otp.setEmail("ann@example.com");
            otp.setOtpCode("123456");
            otp.setCreatedAt(NOW.minusMinutes(1));
            otp.setExpiresAt(NOW.plusMinutes(9));
        }

        @ParameterizedTest
        @ValueSource(strings = {"12345", "1234567", "12a456", "", "١٢٣٤٥٦"})
        @DisplayName("code must be six ASCII digits")
        void rejectsMalformedCode(String code) {
            Result<VerifyOtpResponse, PasswordResetFailure> result = service.verifyOtp("ann@example.com", code);

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.INVALID_OTP_FORMAT);
            verifyNoInteractions(otpRepository);
        }

        @Test
        @DisplayName("valid code yields a reset token")
        void issuesToken() {
            when(otpRepository.findValid("ann@example.com", "123456", NOW)).thenReturn(Optional.of(otp));
            when(otpRepository.markUsedIfValid(otp.getId(), NOW)).thenReturn(1);
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(resetTokenService.issue(user)).thenReturn("signed.jwt.token");
            when(resetTokenService.ttlSeconds()).thenReturn(900L);

            VerifyOtpResponse response = service.verifyOtp(" ANN@example.com", "123456").getValue();

            assertThat(response.resetToken()).isEqualTo("signed.jwt.token");
            assertThat(response.expiresIn()).isEqualTo(900L);
            assertThat(response.message())
                    .isEqualTo("OTP verified successfully. Use the reset token to set a new password.");
        }

        @Test
        @DisplayName("code consumed concurrently is rejected")
        void lostRace() {
            when(otpRepository.findValid("ann@example.com", "123456", NOW)).thenReturn(Optional.of(otp));
            when(otpRepository.markUsedIfValid(otp.getId(), NOW)).thenReturn(0);

            Result<VerifyOtpResponse, PasswordResetFailure> result = service.verifyOtp("ann@example.com", "123456");

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.INVALID_OR_EXPIRED_OTP);
            verifyNoInteractions(resetTokenService);
        }

        @Test
        @DisplayName("unknown, used or expired code is rejected")
        void noValidCode() {
            when(otpRepository.findValid("ann@example.com", "999999", NOW)).thenReturn(Optional.empty());

            Result<VerifyOtpResponse, PasswordResetFailure> result = service.verifyOtp("ann@example.com", "999999");

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.INVALID_OR_EXPIRED_OTP);
            verify(otpRepository, never()).markUsedIfValid(any(), any());
        }
    }

    @Nested
    class Reset {

        private ResetTokenClaims claims;

        @BeforeEach
        void setUp() {
            claims = new ResetTokenClaims(user.getId(), UUID.randomUUID().toString(),
                    CLOCK.instant(), CLOCK.instant().plusSeconds(900), 0L);
        }

        @Test
        @DisplayName("updates the credential, invalidates codes and confirms by email")
        void resets() {
            when(resetTokenService.verify("token")).thenReturn(Optional.of(claims));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(resetTokenService.isCurrentFor(claims, user)).thenReturn(true);

            Result<MessageResponse, PasswordResetFailure> result = service.resetPassword("token", "N3w-Passw0rd!");

            assertThat(result.getValue().message())
                    .isEqualTo("Password has been reset successfully. You can now log in with your new password.");
            var order = inOrder(identityProviderClient, otpRepository, emailService);
            order.verify(identityProviderClient).updateCredential(user.getId(), "N3w-Passw0rd!");
            order.verify(otpRepository).invalidateUserOtps(user.getId());
            order.verify(emailService).sendPasswordResetConfirmationEmail("ann@example.com", "Ann");
        }

        @Test
        @DisplayName("invalid token changes nothing")
        void invalidToken() {
            when(resetTokenService.verify("forged")).thenReturn(Optional.empty());

            Result<MessageResponse, PasswordResetFailure> result = service.resetPassword("forged", "N3w-Passw0rd!");

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.INVALID_OR_EXPIRED_TOKEN);
            verifyNoInteractions(identityProviderClient, userRepository);
        }

        @Test
        @DisplayName("token issued before the last password change is rejected")
        void staleToken() {
            when(resetTokenService.verify("token")).thenReturn(Optional.of(claims));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(resetTokenService.isCurrentFor(claims, user)).thenReturn(false);

            Result<MessageResponse, PasswordResetFailure> result = service.resetPassword("token", "N3w-Passw0rd!");

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.INVALID_OR_EXPIRED_TOKEN);
            verifyNoInteractions(identityProviderClient);
        }

        @Test
        @DisplayName("deleted user is reported as not found")
        void missingUser() {
            when(resetTokenService.verify("token")).thenReturn(Optional.of(claims));
            when(userRepository.findById(user.getId())).thenReturn(Optional.empty());

            assertThat(service.resetPassword("token", "N3w-Passw0rd!").getError().error())
                    .isEqualTo(PasswordResetError.USER_NOT_FOUND);
        }

        @Test
        @DisplayName("identity provider failure leaves outstanding codes untouched")
        void upstreamFailure() {
            when(resetTokenService.verify("token")).thenReturn(Optional.of(claims));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(resetTokenService.isCurrentFor(claims, user)).thenReturn(true);
            doThrow(new IdentityProviderException("provider down"))
                    .when(identityProviderClient).updateCredential(eq(user.getId()), anyString());

            Result<MessageResponse, PasswordResetFailure> result = service.resetPassword("token", "N3w-Passw0rd!");

            assertThat(result.getError().error()).isEqualTo(PasswordResetError.UPSTREAM_UNAVAILABLE);
            verify(otpRepository, never()).invalidateUserOtps(any());
            verifyNoInteractions(emailService);
        }
    }
}
