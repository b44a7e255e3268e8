package uk.gegc.intellicode.features.assignment.infra.grading;

import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.domain.grading.GradeResult;
import uk.gegc.intellicode.features.assignment.domain.model.Question;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class MultipleChoiceGrader extends QuestionGrader {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    protected GradeResult doGrade(Question question, String answerText) {
        boolean caseSensitive = question.isCaseSensitive();
        boolean correct;

        if (question.hasCorrectAnswers()) {
            Set<String> accepted = new HashSet<>(normalizeAll(question.getCorrectAnswers(), caseSensitive));
            List<String> selected = normalizeAll(splitCandidates(answerText, ","), caseSensitive);

            if (selected.isEmpty()) {
                correct = false;
            } else if (selected.size() == 1) {
                correct = accepted.contains(selected.get(0));
            } else {
                // every selection must be right and none may be missing
                correct = accepted.containsAll(selected)
                        && selected.size() == question.getCorrectAnswers().size();
            }
        } else if (hasText(question.getCorrectAnswer()) && answerText != null) {
            correct = normalize(answerText, caseSensitive)
                    .equals(normalize(question.getCorrectAnswer(), caseSensitive));
        } else {
            correct = false;
        }

        return correct
                ? GradeResult.fullCredit(question.getId(), question.getPoints())
                : GradeResult.incorrect(question.getId());
    }

    @Override
    protected List<String> doValidateDefinition(Question question) {
        if (!hasAnswerKey(question)) {
            return List.of("multiple choice questions need correct answers or a correct answer");
        }
        if (question.getOptions() == null || question.getOptions().isEmpty()) {
            return List.of();
        }
        boolean caseSensitive = question.isCaseSensitive();
        Set<String> options = new HashSet<>(normalizeAll(question.getOptions(), caseSensitive));
        List<String> keys = question.hasCorrectAnswers()
                ? question.getCorrectAnswers()
                : List.of(question.getCorrectAnswer());
        List<String> missing = keys.stream()
                .filter(k -> !options.contains(normalize(k, caseSensitive)))
                .toList();
        return missing.isEmpty()
                ? List.of()
                : List.of("correct answers " + missing + " are not among the options");
    }
}
