package uk.gegc.intellicode.shared.api.problem;

import uk.gegc.intellicode.shared.exception.ErrorKind;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://intellicode.app/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== State Errors ====================
    public static final URI ILLEGAL_STATE = URI.create(BASE_URL + "/illegal-state");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== Upstream Errors ====================
    public static final URI UPSTREAM_UNAVAILABLE = URI.create(BASE_URL + "/upstream-unavailable");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static URI forKind(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> VALIDATION_FAILED;
            case NOT_FOUND -> RESOURCE_NOT_FOUND;
            case FORBIDDEN -> ACCESS_DENIED;
            case CONFLICT -> DATA_CONFLICT;
            case INVALID_STATE -> ILLEGAL_STATE;
            case RATE_LIMITED -> RATE_LIMIT_EXCEEDED;
            case UPSTREAM_UNAVAILABLE -> UPSTREAM_UNAVAILABLE;
        };
    }
}
