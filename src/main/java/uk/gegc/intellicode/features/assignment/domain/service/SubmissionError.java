package uk.gegc.intellicode.features.assignment.domain.service;

import uk.gegc.intellicode.shared.exception.ErrorKind;

/**
 * Expected failures of the submission workflow.
 */
public enum SubmissionError {
    ASSIGNMENT_NOT_FOUND(ErrorKind.NOT_FOUND, "Assignment not found or not published"),
    NOT_ENROLLED(ErrorKind.FORBIDDEN, "You are not enrolled in this course"),
    DUPLICATE_SUBMISSION(ErrorKind.CONFLICT, "You have already submitted this assignment"),
    UNKNOWN_QUESTION(ErrorKind.VALIDATION, "Question does not belong to this assignment"),
    DUPLICATE_ANSWER(ErrorKind.VALIDATION, "Each question may be answered only once"),
    WRONG_SUBTYPE(ErrorKind.VALIDATION, "This assignment does not accept this kind of submission"),
    NO_FILES(ErrorKind.VALIDATION, "At least one file is required"),
    FILE_TOO_LARGE(ErrorKind.VALIDATION, "File exceeds the maximum allowed size"),
    MISSING_CODE(ErrorKind.VALIDATION, "Code and language are required"),
    SCORE_OUT_OF_RANGE(ErrorKind.VALIDATION, "Score must be between 0 and the maximum score"),
    SUBMISSION_NOT_FOUND(ErrorKind.NOT_FOUND, "Submission not found or you do not have permission to grade it"),
    NO_SUBMISSION(ErrorKind.NOT_FOUND, "No submission found for this student"),
    ASSIGNMENT_NOT_OWNED(ErrorKind.NOT_FOUND, "Assignment not found or you do not have permission to view it"),
    NOT_COURSE_INSTRUCTOR(ErrorKind.FORBIDDEN, "You do not have permission to manage this assignment"),
    NOT_SUBMISSION_OWNER(ErrorKind.FORBIDDEN, "You can only undo your own submission"),
    UNDO_NOT_ALLOWED(ErrorKind.INVALID_STATE,
            "Students can only undo file upload submissions. Contact your instructor for other assignment types."),
    ALREADY_GRADED(ErrorKind.INVALID_STATE, "Cannot undo a graded submission. Please contact your instructor."),
    UPLOAD_FAILED(ErrorKind.UPSTREAM_UNAVAILABLE, "File upload failed; the submission was not saved"),
    STORAGE_FAILURE(ErrorKind.UPSTREAM_UNAVAILABLE, "Stored files could not be removed; the submission was kept");

    private final ErrorKind kind;
    private final String defaultMessage;

    SubmissionError(ErrorKind kind, String defaultMessage) {
        this.kind = kind;
        this.defaultMessage = defaultMessage;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
