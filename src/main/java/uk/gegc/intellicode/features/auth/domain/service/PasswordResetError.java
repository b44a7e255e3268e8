package uk.gegc.intellicode.features.auth.domain.service;

import uk.gegc.intellicode.shared.exception.ErrorKind;

public enum PasswordResetError {
    RATE_LIMITED(ErrorKind.RATE_LIMITED, "Too many reset requests. Please wait before requesting a new code."),
    INVALID_OTP_FORMAT(ErrorKind.VALIDATION, "OTP code must be exactly 6 digits"),
    INVALID_OR_EXPIRED_OTP(ErrorKind.VALIDATION, "Invalid or expired OTP code"),
    INVALID_OR_EXPIRED_TOKEN(ErrorKind.VALIDATION, "Invalid or expired reset token"),
    USER_NOT_FOUND(ErrorKind.NOT_FOUND, "User not found"),
    UPSTREAM_UNAVAILABLE(ErrorKind.UPSTREAM_UNAVAILABLE, "Password could not be updated. Please try again later.");

    private final ErrorKind kind;
    private final String message;

    PasswordResetError(ErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String message() {
        return message;
    }
}
