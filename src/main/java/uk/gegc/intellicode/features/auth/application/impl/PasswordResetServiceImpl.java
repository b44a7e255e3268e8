package uk.gegc.intellicode.features.auth.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.intellicode.features.auth.api.dto.MessageResponse;
import uk.gegc.intellicode.features.auth.api.dto.VerifyOtpResponse;
import uk.gegc.intellicode.features.auth.application.PasswordResetService;
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
import uk.gegc.intellicode.features.user.domain.repository.UserRepository;
import uk.gegc.intellicode.shared.email.EmailService;
import uk.gegc.intellicode.shared.result.Result;
import uk.gegc.intellicode.shared.util.EmailMasker;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetServiceImpl implements PasswordResetService {

    static final String REQUEST_MESSAGE = "If an account with that email exists, a password reset code has been sent.";
    static final String VERIFIED_MESSAGE = "OTP verified successfully. Use the reset token to set a new password.";
    static final String RESET_MESSAGE = "Password has been reset successfully. You can now log in with your new password.";

    private static final Pattern OTP_FORMAT = Pattern.compile("^[0-9]{6}$");

    private final UserRepository userRepository;
    private final PasswordResetOtpRepository otpRepository;
    private final OtpCodeGenerator codeGenerator;
    private final ResetTokenService resetTokenService;
    private final IdentityProviderClient identityProviderClient;
    private final EmailService emailService;
    private final OtpProperties otpProperties;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    @Transactional
    public Result<MessageResponse, PasswordResetFailure> requestOtp(String email) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> found = userRepository.findByEmailIgnoreCase(normalizedEmail);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown email {}", EmailMasker.mask(normalizedEmail));
            return Result.ok(new MessageResponse(REQUEST_MESSAGE));
        }
        User user = found.get();

        LocalDateTime now = LocalDateTime.now(utcClock);
        LocalDateTime windowStart = now.minus(otpProperties.getRateWindow());
        // count then insert is not atomic; concurrent requests may slightly exceed the limit
        long recentRequests = otpRepository.countByEmailAndCreatedAtAfter(normalizedEmail, windowStart);
        if (recentRequests >= otpProperties.getMaxRequestsPerWindow()) {
            long retryAfter = otpRepository.findFirstByEmailAndCreatedAtAfterOrderByCreatedAtAsc(normalizedEmail, windowStart)
                    .map(oldest -> Duration.between(now, oldest.getCreatedAt().plus(otpProperties.getRateWindow())).toSeconds())
                    .orElse(otpProperties.getRateWindow().toSeconds());
            log.warn("Password reset rate limit reached for {} ({} requests in window)",
                    EmailMasker.mask(normalizedEmail), recentRequests);
            return Result.err(PasswordResetFailure.rateLimited(retryAfter));
        }

        otpRepository.invalidateUserOtps(user.getId());

        PasswordResetOtp otp = new PasswordResetOtp();
        otp.setUserId(user.getId());
        otp.setEmail(normalizedEmail);
        otp.setOtpCode(codeGenerator.generate());
        otp.setCreatedAt(now);
        otp.setExpiresAt(now.plus(otpProperties.getCodeTtl()));
        otpRepository.save(otp);
        log.info("Password reset OTP issued for user {}", user.getId());

        try {
            emailService.sendPasswordResetOtpEmail(user.getEmail(), user.getFirstName(), otp.getOtpCode(),
                    otpProperties.getCodeTtl().toMinutes());
        } catch (RuntimeException ex) {
            // the code is stored either way; the user can request another one
            log.error("Failed to dispatch password reset OTP to {}", EmailMasker.mask(user.getEmail()), ex);
        }

        return Result.ok(new MessageResponse(REQUEST_MESSAGE));
    }

    @Override
    @Transactional
    public Result<VerifyOtpResponse, PasswordResetFailure> verifyOtp(String email, String otpCode) {
        if (otpCode == null || !OTP_FORMAT.matcher(otpCode).matches()) {
            return Result.err(PasswordResetFailure.of(PasswordResetError.INVALID_OTP_FORMAT));
        }
        String normalizedEmail = normalizeEmail(email);
        LocalDateTime now = LocalDateTime.now(utcClock);

        Optional<PasswordResetOtp> found = otpRepository.findValid(normalizedEmail, otpCode, now);
        if (found.isEmpty()) {
            log.debug("No valid OTP for {}", EmailMasker.mask(normalizedEmail));
            return Result.err(PasswordResetFailure.of(PasswordResetError.INVALID_OR_EXPIRED_OTP));
        }
        PasswordResetOtp otp = found.get();

        // a concurrent verification of the same code may have consumed it first
        if (otpRepository.markUsedIfValid(otp.getId(), now) == 0) {
            return Result.err(PasswordResetFailure.of(PasswordResetError.INVALID_OR_EXPIRED_OTP));
        }

        Optional<User> user = userRepository.findById(otp.getUserId());
        if (user.isEmpty()) {
            return Result.err(PasswordResetFailure.of(PasswordResetError.INVALID_OR_EXPIRED_OTP));
        }

        String resetToken = resetTokenService.issue(user.get());
        log.info("Password reset OTP verified for user {}", otp.getUserId());
        return Result.ok(new VerifyOtpResponse(resetToken, resetTokenService.ttlSeconds(), VERIFIED_MESSAGE));
    }

    @Override
    public Result<MessageResponse, PasswordResetFailure> resetPassword(String resetToken, String newPassword) {
        Optional<ResetTokenClaims> claims = resetTokenService.verify(resetToken);
        if (claims.isEmpty()) {
            return Result.err(PasswordResetFailure.of(PasswordResetError.INVALID_OR_EXPIRED_TOKEN));
        }

        Optional<User> found = userRepository.findById(claims.get().userId());
        if (found.isEmpty()) {
            log.warn("Reset token presented for missing user {}", claims.get().userId());
            return Result.err(PasswordResetFailure.of(PasswordResetError.USER_NOT_FOUND));
        }
        User user = found.get();

        if (!resetTokenService.isCurrentFor(claims.get(), user)) {
            log.warn("Reset token {} for user {} predates the current password", claims.get().tokenId(), user.getId());
            return Result.err(PasswordResetFailure.of(PasswordResetError.INVALID_OR_EXPIRED_TOKEN));
        }

        try {
            identityProviderClient.updateCredential(user.getId(), newPassword);
        } catch (IdentityProviderException ex) {
            log.error("Identity provider failed to update credential for user {}", user.getId(), ex);
            return Result.err(PasswordResetFailure.of(PasswordResetError.UPSTREAM_UNAVAILABLE));
        }

        int invalidated = otpRepository.invalidateUserOtps(user.getId());
        log.info("Password reset completed for user {} ({} outstanding OTPs invalidated)", user.getId(), invalidated);

        try {
            emailService.sendPasswordResetConfirmationEmail(user.getEmail(), user.getFirstName());
        } catch (RuntimeException ex) {
            log.error("Failed to dispatch password reset confirmation to {}", EmailMasker.mask(user.getEmail()), ex);
        }

        return Result.ok(new MessageResponse(RESET_MESSAGE));
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
