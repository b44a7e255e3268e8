package uk.gegc.intellicode.features.assignment.api.dto;

import java.util.UUID;

public record SubmissionAnswerDto(
        UUID questionId,
        String answerText,
        boolean isCorrect,
        int pointsEarned
) {
}
