package uk.gegc.intellicode.features.assignment.domain.grading;

import java.util.UUID;

public record AnswerInput(UUID questionId, String answerText) {
}
