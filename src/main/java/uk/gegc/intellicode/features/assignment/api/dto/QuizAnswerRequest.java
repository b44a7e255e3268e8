package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "QuizAnswerRequest", description = "Answer to one question of a quiz assignment")
public record QuizAnswerRequest(
        @Schema(description = "UUID of the question being answered", requiredMode = Schema.RequiredMode.REQUIRED,
                example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        @NotNull(message = "Question ID is required")
        UUID questionId,

        @Schema(description = "Answer text. Multiple choice selections are comma separated, enumeration items one per line",
                example = "Mercury\nVenus\nEarth")
        @Size(max = 4000, message = "Answer must not exceed 4000 characters")
        String answerText
) {
}
