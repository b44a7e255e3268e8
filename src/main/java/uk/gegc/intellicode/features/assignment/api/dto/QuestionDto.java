package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.List;
import java.util.UUID;

@Schema(name = "QuestionDto", description = "A question; the answer key is only present for the course instructor")
public record QuestionDto(
        UUID id,
        int position,
        String text,
        QuestionType type,
        int points,
        List<String> options,
        String correctAnswer,
        List<String> correctAnswers,
        String explanation,
        Boolean caseSensitive,
        Boolean isTrue
) {
}
