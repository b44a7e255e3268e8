package uk.gegc.intellicode.features.assignment.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.api.dto.AssignmentDto;
import uk.gegc.intellicode.features.assignment.api.dto.AttachmentDto;
import uk.gegc.intellicode.features.assignment.api.dto.QuestionDto;
import uk.gegc.intellicode.features.assignment.api.dto.QuestionRequest;
import uk.gegc.intellicode.features.assignment.domain.model.Assignment;
import uk.gegc.intellicode.features.assignment.domain.model.AssignmentAttachment;
import uk.gegc.intellicode.features.assignment.domain.model.Question;

import java.util.ArrayList;
import java.util.List;

@Component
public class AssignmentMapper {

    /**
     * @param showAnswers include the answer key; only the course instructor sees it
     */
    public AssignmentDto toDto(Assignment assignment, boolean showAnswers, boolean alreadySubmitted) {
        List<QuestionDto> questions = assignment.getQuestions().stream()
                .map(q -> toQuestionDto(q, showAnswers))
                .toList();
        List<AttachmentDto> attachments = assignment.getAttachments().stream()
                .map(this::toAttachmentDto)
                .toList();

        return new AssignmentDto(
                assignment.getId(),
                assignment.getModule().getId(),
                assignment.getCourse().getId(),
                assignment.getTitle(),
                assignment.getDescription(),
                assignment.getSubtype(),
                assignment.getPoints(),
                assignment.maxScore(),
                assignment.getDueDate(),
                assignment.isPublished(),
                assignment.getStarterCode(),
                assignment.getCreatedAt(),
                assignment.getUpdatedAt(),
                alreadySubmitted,
                questions,
                attachments
        );
    }

    public QuestionDto toQuestionDto(Question question, boolean showAnswers) {
        return new QuestionDto(
                question.getId(),
                question.getPosition(),
                question.getText(),
                question.getType(),
                question.getPoints(),
                List.copyOf(question.getOptions()),
                showAnswers ? question.getCorrectAnswer() : null,
                showAnswers ? List.copyOf(question.getCorrectAnswers()) : List.of(),
                showAnswers ? question.getExplanation() : null,
                showAnswers ? question.isCaseSensitive() : null,
                showAnswers ? question.getIsTrue() : null
        );
    }

    /**
     * Copies the request onto the question, leaving its id and position alone.
     */
    public void applyQuestion(QuestionRequest request, Question question) {
        question.setText(request.text().trim());
        question.setType(request.type());
        question.setPoints(request.points());
        question.setCorrectAnswer(request.correctAnswer());
        question.setCorrectAnswers(new ArrayList<>(request.correctAnswers()));
        question.setOptions(new ArrayList<>(request.options()));
        question.setExplanation(request.explanation());
        question.setCaseSensitive(request.caseSensitive());
        question.setIsTrue(request.isTrue());
    }

    private AttachmentDto toAttachmentDto(AssignmentAttachment attachment) {
        return new AttachmentDto(
                attachment.getId(),
                attachment.getOriginalName(),
                attachment.getMimeType(),
                attachment.getFileType(),
                attachment.getSize(),
                attachment.getPublicUrl(),
                attachment.getUploadedAt()
        );
    }
}
