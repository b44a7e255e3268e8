package uk.gegc.intellicode.features.course.domain.model;

public enum EnrollmentStatus {
    ACTIVE,
    DROPPED,
    COMPLETED
}
