package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.intellicode.features.assignment.domain.model.AssignmentSubtype;

import java.time.LocalDateTime;
import java.util.List;

@Schema(name = "CreateAssignmentRequest", description = "A new assignment in a course module")
public record CreateAssignmentRequest(
        @Schema(description = "Assignment title", example = "Inner planets quiz")
        @NotBlank(message = "Title is required")
        @Size(max = 255, message = "Title must not exceed 255 characters")
        String title,

        @Schema(description = "Instructions for students")
        @Size(max = 4000, message = "Description must not exceed 4000 characters")
        String description,

        @Schema(description = "How students submit", example = "QUIZ_FORM")
        @NotNull(message = "Assignment subtype is required")
        AssignmentSubtype subtype,

        @Schema(description = "Points for manually graded assignments", example = "10")
        @NotNull(message = "Points are required")
        @Min(value = 0, message = "Points must not be negative")
        Integer points,

        @Schema(description = "Due date (UTC)")
        LocalDateTime dueDate,

        @Schema(description = "Visible to enrolled students; defaults to true", example = "true")
        Boolean published,

        @Schema(description = "Starter code, kept only for code sandbox assignments")
        String starterCode,

        @Schema(description = "Questions for quiz form assignments")
        List<@Valid QuestionRequest> questions
) {
    public CreateAssignmentRequest {
        if (published == null) {
            published = true;
        }
        if (questions == null) {
            questions = List.of();
        }
    }
}
