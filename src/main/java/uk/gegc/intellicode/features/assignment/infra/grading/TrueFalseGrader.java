package uk.gegc.intellicode.features.assignment.infra.grading;

import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.domain.grading.GradeResult;
import uk.gegc.intellicode.features.assignment.domain.model.Question;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.List;

@Component
public class TrueFalseGrader extends QuestionGrader {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TRUE_FALSE;
    }

    @Override
    protected GradeResult doGrade(Question question, String answerText) {
        if (question.getIsTrue() == null || answerText == null) {
            return GradeResult.incorrect(question.getId());
        }
        // not trimmed: anything other than "true" in any case reads as false
        boolean studentSaysTrue = answerText.equalsIgnoreCase("true");
        return studentSaysTrue == question.getIsTrue()
                ? GradeResult.fullCredit(question.getId(), question.getPoints())
                : GradeResult.incorrect(question.getId());
    }

    @Override
    protected List<String> doValidateDefinition(Question question) {
        return question.getIsTrue() == null
                ? List.of("true/false questions need is_true")
                : List.of();
    }
}
