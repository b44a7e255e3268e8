package uk.gegc.intellicode.features.assignment.infra.grading;

import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.domain.grading.GradeResult;
import uk.gegc.intellicode.features.assignment.domain.model.Question;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.List;

@Component
public class IdentificationGrader extends QuestionGrader {

    @Override
    public QuestionType supportedType() {
        return QuestionType.IDENTIFICATION;
    }

    @Override
    protected GradeResult doGrade(Question question, String answerText) {
        if (answerText == null) {
            return GradeResult.incorrect(question.getId());
        }
        boolean caseSensitive = question.isCaseSensitive();
        String answer = normalize(answerText, caseSensitive);

        boolean correct;
        if (question.hasCorrectAnswers()) {
            correct = !answer.isEmpty()
                    && normalizeAll(question.getCorrectAnswers(), caseSensitive).contains(answer);
        } else {
            correct = hasText(question.getCorrectAnswer())
                    && answer.equals(normalize(question.getCorrectAnswer(), caseSensitive));
        }

        return correct
                ? GradeResult.fullCredit(question.getId(), question.getPoints())
                : GradeResult.incorrect(question.getId());
    }

    @Override
    protected List<String> doValidateDefinition(Question question) {
        return hasAnswerKey(question)
                ? List.of()
                : List.of("identification questions need correct answers or a correct answer");
    }
}
