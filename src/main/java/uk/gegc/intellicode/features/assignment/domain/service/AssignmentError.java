package uk.gegc.intellicode.features.assignment.domain.service;

import uk.gegc.intellicode.shared.exception.ErrorKind;

/**
 * Expected failures of assignment authoring and viewing.
 */
public enum AssignmentError {
    MODULE_NOT_FOUND(ErrorKind.NOT_FOUND,
            "Module not found or you do not have permission to create assignments in this module"),
    MODULE_NOT_ACCESSIBLE(ErrorKind.NOT_FOUND, "Module not found or you do not have access to it"),
    ASSIGNMENT_NOT_FOUND(ErrorKind.NOT_FOUND, "Assignment not found or you do not have access to it"),
    ASSIGNMENT_NOT_OWNED(ErrorKind.NOT_FOUND, "Assignment not found or you do not have permission to modify it"),
    QUESTION_NOT_FOUND(ErrorKind.NOT_FOUND, "Question not found in this assignment"),
    INVALID_QUESTION(ErrorKind.VALIDATION, "Question definition is incomplete"),
    ATTACHMENT_TOO_LARGE(ErrorKind.VALIDATION, "Attachment exceeds the maximum allowed size"),
    QUESTIONS_LOCKED(ErrorKind.CONFLICT, "Questions cannot be changed once students have submitted"),
    SUBTYPE_LOCKED(ErrorKind.CONFLICT, "The assignment type cannot be changed once students have submitted"),
    HAS_SUBMISSIONS(ErrorKind.CONFLICT, "Cannot delete assignment with existing submissions"),
    ATTACHMENT_UPLOAD_FAILED(ErrorKind.UPSTREAM_UNAVAILABLE, "Attachment upload failed; the assignment was not created"),
    ATTACHMENT_CLEANUP_FAILED(ErrorKind.UPSTREAM_UNAVAILABLE,
            "Attached files could not be removed; the assignment was kept");

    private final ErrorKind kind;
    private final String defaultMessage;

    AssignmentError(ErrorKind kind, String defaultMessage) {
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
