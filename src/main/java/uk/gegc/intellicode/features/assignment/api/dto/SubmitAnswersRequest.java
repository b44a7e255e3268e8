package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(name = "SubmitAnswersRequest", description = "Answers for a quiz assignment; unanswered questions score zero")
public record SubmitAnswersRequest(
        @Schema(description = "Answers, at most one per question", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Answers are required")
        List<@Valid QuizAnswerRequest> answers
) {
}
