package uk.gegc.intellicode.features.assignment.domain.model;

public enum AssignmentSubtype {
    QUIZ_FORM,      // Auto-graded questions
    FILE_UPLOAD,    // Uploaded files, graded manually
    CODE_SANDBOX    // Submitted source code, graded manually
}
