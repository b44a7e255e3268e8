package uk.gegc.intellicode.features.assignment.domain.exception;

import uk.gegc.intellicode.shared.exception.ApiException;
import uk.gegc.intellicode.shared.exception.ErrorKind;

/**
 * Removing a submission stopped part way because stored files could not be
 * deleted. The submission row is left in place so the undo can be retried.
 */
public class UndoIncompleteException extends ApiException {

    public UndoIncompleteException(String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, "STORAGE_FAILURE", message);
    }
}
