package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SubmissionForGradingDto", description = "Submission as shown to the instructor while grading")
public record SubmissionForGradingDto(
        String assignmentTitle,
        StudentSummaryDto student,
        SubmissionDto submission
) {
}
