package uk.gegc.intellicode.shared.exception;

public class RateLimitExceededException extends ApiException {
    private final long retryAfterSeconds;

    public RateLimitExceededException(String code, String message, long retryAfterSeconds) {
        super(ErrorKind.RATE_LIMITED, code, message);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
