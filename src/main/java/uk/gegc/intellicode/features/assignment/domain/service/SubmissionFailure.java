package uk.gegc.intellicode.features.assignment.domain.service;

import uk.gegc.intellicode.features.assignment.domain.exception.UndoIncompleteException;
import uk.gegc.intellicode.shared.exception.ApiException;

/**
 * A {@link SubmissionError} together with the message shown to the caller.
 */
public record SubmissionFailure(SubmissionError error, String message) {

    public static SubmissionFailure of(SubmissionError error) {
        return new SubmissionFailure(error, error.defaultMessage());
    }

    public static SubmissionFailure of(SubmissionError error, String message) {
        return new SubmissionFailure(error, message);
    }

    public ApiException toException() {
        if (error == SubmissionError.STORAGE_FAILURE) {
            return new UndoIncompleteException(message);
        }
        return new ApiException(error.kind(), error.name(), message);
    }
}
