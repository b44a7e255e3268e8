package uk.gegc.intellicode.features.assignment.domain.model;

public enum SubmissionStatus {
    SUBMITTED,
    GRADED
}
