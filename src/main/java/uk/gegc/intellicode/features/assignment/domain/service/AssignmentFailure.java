package uk.gegc.intellicode.features.assignment.domain.service;

import uk.gegc.intellicode.shared.exception.ApiException;

public record AssignmentFailure(AssignmentError error, String message) {

    public static AssignmentFailure of(AssignmentError error) {
        return new AssignmentFailure(error, error.defaultMessage());
    }

    public static AssignmentFailure of(AssignmentError error, String message) {
        return new AssignmentFailure(error, message);
    }

    public ApiException toException() {
        return new ApiException(error.kind(), error.name(), message);
    }
}
