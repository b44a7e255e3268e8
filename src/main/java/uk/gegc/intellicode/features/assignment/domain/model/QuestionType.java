package uk.gegc.intellicode.features.assignment.domain.model;

public enum QuestionType {
    MULTIPLE_CHOICE,
    TRUE_FALSE,
    IDENTIFICATION,
    ENUMERATION
}
