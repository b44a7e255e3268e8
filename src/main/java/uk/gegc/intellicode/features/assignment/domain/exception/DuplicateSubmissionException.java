package uk.gegc.intellicode.features.assignment.domain.exception;

import uk.gegc.intellicode.features.assignment.domain.service.SubmissionError;
import uk.gegc.intellicode.shared.exception.ApiException;
import uk.gegc.intellicode.shared.exception.ErrorKind;

/**
 * A concurrent submission won the race on the (assignment, student) unique key.
 * Thrown rather than returned so the surrounding transaction rolls back.
 */
public class DuplicateSubmissionException extends ApiException {

    public DuplicateSubmissionException(Throwable cause) {
        super(ErrorKind.CONFLICT, SubmissionError.DUPLICATE_SUBMISSION.name(),
                SubmissionError.DUPLICATE_SUBMISSION.defaultMessage(), cause);
    }
}
