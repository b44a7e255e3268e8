package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "StudentScoreDto", description = "Score of one student for an assignment")
public record StudentScoreDto(
        UUID studentId,
        String studentName,
        String studentEmail,
        int score,
        int maxScore,
        @Schema(description = "Score as a whole percentage of max score; 0 when max score is 0", example = "80")
        int percentage,
        SubmissionStatus status,
        LocalDateTime submittedAt
) {
}
