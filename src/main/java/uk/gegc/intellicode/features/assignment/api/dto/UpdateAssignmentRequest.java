package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import uk.gegc.intellicode.features.assignment.domain.model.AssignmentSubtype;

import java.time.LocalDateTime;
import java.util.List;

@Schema(name = "UpdateAssignmentRequest", description = "Fields to change; omitted fields keep their value")
public record UpdateAssignmentRequest(
        @Size(min = 1, max = 255, message = "Title must be between 1 and 255 characters")
        String title,

        @Size(max = 4000, message = "Description must not exceed 4000 characters")
        String description,

        AssignmentSubtype subtype,

        @Min(value = 0, message = "Points must not be negative")
        Integer points,

        LocalDateTime dueDate,

        Boolean published,

        String starterCode,

        @Schema(description = "When present, replaces every question of the assignment")
        List<@Valid QuestionRequest> questions
) {
}
