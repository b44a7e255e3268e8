package uk.gegc.intellicode.features.assignment.api.dto;

public record UndoSubmissionResponse(boolean success, String message) {
}
