package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.List;

@Schema(name = "QuestionRequest", description = "Definition of one quiz question and its answer key")
public record QuestionRequest(
        @Schema(description = "Question text", example = "Name the inner planets")
        @NotBlank(message = "Question text is required")
        @Size(max = 2000, message = "Question text must not exceed 2000 characters")
        String text,

        @Schema(description = "Question type", example = "ENUMERATION")
        @NotNull(message = "Question type is required")
        QuestionType type,

        @Schema(description = "Points for a fully correct answer", example = "9")
        @NotNull(message = "Points are required")
        @Min(value = 1, message = "Points must be at least 1")
        Integer points,

        @Schema(description = "Single correct answer for multiple choice or identification questions")
        @Size(max = 1000, message = "Correct answer must not exceed 1000 characters")
        String correctAnswer,

        @Schema(description = "Accepted answers; every entry is required for enumeration questions")
        List<@Size(max = 1000, message = "Correct answers must not exceed 1000 characters") String> correctAnswers,

        @Schema(description = "Choices shown for multiple choice questions")
        List<@Size(max = 1000, message = "Options must not exceed 1000 characters") String> options,

        @Schema(description = "Explanation shown to instructors")
        @Size(max = 2000, message = "Explanation must not exceed 2000 characters")
        String explanation,

        @Schema(description = "Compare answers case sensitively", example = "false")
        Boolean caseSensitive,

        @Schema(description = "Correct value of a true/false question")
        Boolean isTrue
) {
    public QuestionRequest {
        if (correctAnswers == null) {
            correctAnswers = List.of();
        }
        if (options == null) {
            options = List.of();
        }
        if (caseSensitive == null) {
            caseSensitive = false;
        }
    }
}
