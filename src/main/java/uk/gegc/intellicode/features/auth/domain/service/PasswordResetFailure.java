package uk.gegc.intellicode.features.auth.domain.service;

import uk.gegc.intellicode.shared.exception.ApiException;
import uk.gegc.intellicode.shared.exception.RateLimitExceededException;

/**
 * @param retryAfterSeconds seconds until a new request may succeed; only meaningful for {@code RATE_LIMITED}
 */
public record PasswordResetFailure(PasswordResetError error, long retryAfterSeconds) {

    public static PasswordResetFailure of(PasswordResetError error) {
        return new PasswordResetFailure(error, 0);
    }

    public static PasswordResetFailure rateLimited(long retryAfterSeconds) {
        return new PasswordResetFailure(PasswordResetError.RATE_LIMITED, retryAfterSeconds);
    }

    public ApiException toException() {
        if (error == PasswordResetError.RATE_LIMITED) {
            return new RateLimitExceededException(error.name(), error.message(), retryAfterSeconds);
        }
        return new ApiException(error.kind(), error.name(), error.message());
    }
}
