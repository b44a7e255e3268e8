package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.intellicode.features.assignment.domain.model.AssignmentSubtype;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Schema(name = "AssignmentDto", description = "An assignment with its questions and attachments")
public record AssignmentDto(
        UUID id,
        UUID moduleId,
        UUID courseId,
        String title,
        String description,
        AssignmentSubtype subtype,
        int points,
        int maxScore,
        LocalDateTime dueDate,
        boolean published,
        String starterCode,
        Instant createdAt,
        Instant updatedAt,
        @Schema(description = "Whether the caller already submitted this assignment")
        boolean alreadySubmitted,
        List<QuestionDto> questions,
        List<AttachmentDto> attachments
) {
}
