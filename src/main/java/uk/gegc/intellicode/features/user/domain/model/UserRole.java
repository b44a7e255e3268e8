package uk.gegc.intellicode.features.user.domain.model;

public enum UserRole {
    STUDENT,    // Enrolls in courses and submits assignments
    TEACHER,    // Owns courses, grades and resets submissions
    ADMIN;      // Manages users and platform settings

    public String authority() {
        return "ROLE_" + name();
    }
}
