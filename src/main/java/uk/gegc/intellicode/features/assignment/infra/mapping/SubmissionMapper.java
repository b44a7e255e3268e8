package uk.gegc.intellicode.features.assignment.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.domain.model.Submission;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionAnswer;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionFile;
import uk.gegc.intellicode.features.user.domain.model.User;

import java.util.List;

@Component
public class SubmissionMapper {

    public SubmissionDto toDto(Submission submission) {
        List<SubmissionAnswerDto> answers = submission.getAnswers().stream()
                .map(this::toAnswerDto)
                .toList();
        List<SubmissionFileDto> files = submission.getFiles().stream()
                .map(this::toFileDto)
                .toList();

        return new SubmissionDto(
                submission.getId(),
                submission.getAssignmentId(),
                submission.getStudentId(),
                submission.getScore(),
                submission.getMaxScore(),
                submission.getStatus(),
                submission.getFeedback(),
                submission.getSubmittedAt(),
                submission.getGradedAt(),
                submission.getSubmittedCode(),
                submission.getCodeLanguage(),
                answers,
                files
        );
    }

    public SubmissionForGradingDto toGradingDto(Submission submission, String assignmentTitle, User student) {
        return new SubmissionForGradingDto(assignmentTitle, toStudentSummary(student), toDto(submission));
    }

    public StudentScoreDto toScoreDto(Submission submission, User student) {
        int percentage = submission.getMaxScore() > 0
                ? (int) Math.round((double) submission.getScore() / submission.getMaxScore() * 100)
                : 0;
        return new StudentScoreDto(
                submission.getStudentId(),
                student != null ? student.getFullName() : null,
                student != null ? student.getEmail() : null,
                submission.getScore(),
                submission.getMaxScore(),
                percentage,
                submission.getStatus(),
                submission.getSubmittedAt()
        );
    }

    private StudentSummaryDto toStudentSummary(User student) {
        if (student == null) {
            return null;
        }
        return new StudentSummaryDto(student.getId(), student.getFirstName(), student.getLastName(), student.getEmail());
    }

    private SubmissionAnswerDto toAnswerDto(SubmissionAnswer answer) {
        return new SubmissionAnswerDto(
                answer.getQuestionId(),
                answer.getAnswerText(),
                answer.isCorrect(),
                answer.getPointsEarned()
        );
    }

    private SubmissionFileDto toFileDto(SubmissionFile file) {
        return new SubmissionFileDto(
                file.getId(),
                file.getOriginalName(),
                file.getMimeType(),
                file.getFileType(),
                file.getSize(),
                file.getPublicUrl(),
                file.getUploadedAt()
        );
    }
}
