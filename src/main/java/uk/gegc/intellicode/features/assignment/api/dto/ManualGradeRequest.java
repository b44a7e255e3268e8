package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "ManualGradeRequest", description = "Score assigned by the course instructor")
public record ManualGradeRequest(
        @Schema(description = "Score between 0 and the submission's max score", example = "8")
        @NotNull(message = "Score is required")
        @Min(value = 0, message = "Score must not be negative")
        Integer score,

        @Schema(description = "Optional feedback for the student")
        @Size(max = 4000, message = "Feedback must not exceed 4000 characters")
        String feedback,

        @Schema(description = "Mark the submission as graded; otherwise it stays submitted", example = "true")
        Boolean markAsGraded
) {
    public ManualGradeRequest {
        if (markAsGraded == null) {
            markAsGraded = false;
        }
    }
}
