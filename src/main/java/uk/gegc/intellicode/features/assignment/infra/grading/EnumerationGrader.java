package uk.gegc.intellicode.features.assignment.infra.grading;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.config.GradingProperties;
import uk.gegc.intellicode.features.assignment.domain.grading.EnumerationMatchMode;
import uk.gegc.intellicode.features.assignment.domain.grading.GradeResult;
import uk.gegc.intellicode.features.assignment.domain.model.Question;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.List;

/**
 * Partial credit grader for list answers. Items go one per line; a single line
 * containing commas is read as a comma separated list instead.
 */
@Component
public class EnumerationGrader extends QuestionGrader {

    private final EnumerationMatchMode matchMode;

    @Autowired
    public EnumerationGrader(GradingProperties properties) {
        this(properties.getEnumerationMatchMode());
    }

    public EnumerationGrader(EnumerationMatchMode matchMode) {
        this.matchMode = matchMode;
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.ENUMERATION;
    }

    @Override
    protected GradeResult doGrade(Question question, String answerText) {
        if (!question.hasCorrectAnswers()) {
            return GradeResult.incorrect(question.getId());
        }
        boolean caseSensitive = question.isCaseSensitive();
        List<String> accepted = normalizeAll(question.getCorrectAnswers(), caseSensitive);

        List<String> items = splitCandidates(answerText, "\n");
        if (items.size() == 1 && items.get(0).contains(",")) {
            items = splitCandidates(items.get(0), ",");
        }
        List<String> candidates = normalizeAll(items, caseSensitive);
        if (matchMode == EnumerationMatchMode.DISTINCT_CANDIDATES) {
            candidates = candidates.stream().distinct().toList();
        }

        long matched = candidates.stream().filter(accepted::contains).count();
        int total = accepted.size();
        double ratio = (double) matched / total;

        // a repeated item can reach the ratio without naming every answer
        boolean coversAll = candidates.containsAll(accepted);
        if (ratio == 1.0 && candidates.size() == total && coversAll) {
            return GradeResult.fullCredit(question.getId(), question.getPoints());
        }
        if (matched == 0) {
            return GradeResult.incorrect(question.getId());
        }
        long earned = Math.round(question.getPoints() * ratio);
        // repeated items can push the ratio past 1 in COUNT_EVERY_MATCH mode
        int capped = (int) Math.min(earned, question.getPoints());
        return new GradeResult(question.getId(), false, capped);
    }

    @Override
    protected List<String> doValidateDefinition(Question question) {
        return question.hasCorrectAnswers()
                ? List.of()
                : List.of("enumeration questions need a list of correct answers");
    }
}
