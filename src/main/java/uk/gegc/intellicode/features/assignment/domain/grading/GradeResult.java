package uk.gegc.intellicode.features.assignment.domain.grading;

import java.util.UUID;

public record GradeResult(UUID questionId, boolean correct, int pointsEarned) {

    public static GradeResult incorrect(UUID questionId) {
        return new GradeResult(questionId, false, 0);
    }

    public static GradeResult fullCredit(UUID questionId, int points) {
        return new GradeResult(questionId, true, points);
    }
}
