package uk.gegc.intellicode.features.assignment.domain.exception;

import uk.gegc.intellicode.shared.exception.ApiException;
import uk.gegc.intellicode.shared.exception.ErrorKind;

/**
 * Storing an uploaded file, or recording it, failed after the owning row was
 * written. Objects already stored have been deleted; throwing rolls the rows back.
 */
public class UploadFailedException extends ApiException {

    public UploadFailedException(String code, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, code, message, cause);
    }
}
