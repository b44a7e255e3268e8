package uk.gegc.intellicode.features.assignment.domain.grading;

public record GradedAnswer(String answerText, GradeResult result) {
}
