package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Schema(name = "SubmissionDto", description = "A student's submission with its graded answers and files")
public record SubmissionDto(
        UUID id,
        UUID assignmentId,
        UUID studentId,
        int score,
        int maxScore,
        SubmissionStatus status,
        String feedback,
        LocalDateTime submittedAt,
        LocalDateTime gradedAt,
        String submittedCode,
        String codeLanguage,
        List<SubmissionAnswerDto> answers,
        List<SubmissionFileDto> files
) {
}
