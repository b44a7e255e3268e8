package uk.gegc.intellicode.shared.exception;

import lombok.Getter;

/**
 * Raised at the API boundary when a domain result carries an expected failure.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public ApiException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public ApiException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }
}
