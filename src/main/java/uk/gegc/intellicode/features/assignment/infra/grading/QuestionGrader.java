package uk.gegc.intellicode.features.assignment.infra.grading;

import uk.gegc.intellicode.features.assignment.domain.grading.GradeResult;
import uk.gegc.intellicode.features.assignment.domain.model.Question;
import uk.gegc.intellicode.features.assignment.domain.model.QuestionType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Grades a single answer against one question type. Implementations are pure:
 * no I/O and no clock.
 */
public abstract class QuestionGrader {

    /**
     * Returns the question type that this grader supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    public GradeResult grade(Question question, String answerText) {
        if (question.getType() != supportedType()) {
            throw new IllegalArgumentException("Grader for " + supportedType()
                    + " cannot grade question of type " + question.getType());
        }
        return doGrade(question, answerText);
    }

    protected abstract GradeResult doGrade(Question question, String answerText);

    /**
     * Checks that the question carries the answer key this type grades against.
     *
     * @return problems found, empty when the question can be graded
     */
    public List<String> validateDefinition(Question question) {
        List<String> problems = new ArrayList<>();
        if (question.getCorrectAnswers() != null
                && question.getCorrectAnswers().stream().anyMatch(a -> !hasText(a))) {
            problems.add("correct answers must not be blank");
        }
        if (question.getOptions() != null
                && question.getOptions().stream().anyMatch(o -> !hasText(o))) {
            problems.add("options must not be blank");
        }
        if (problems.isEmpty()) {
            problems.addAll(doValidateDefinition(question));
        }
        return problems;
    }

    protected abstract List<String> doValidateDefinition(Question question);

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * True when a list of correct answers or a non-blank single answer is set.
     */
    protected static boolean hasAnswerKey(Question question) {
        return question.hasCorrectAnswers() || hasText(question.getCorrectAnswer());
    }

    protected static String normalize(String value, boolean caseSensitive) {
        String trimmed = value.trim();
        return caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }

    protected static List<String> normalizeAll(List<String> values, boolean caseSensitive) {
        return values.stream().map(v -> normalize(v, caseSensitive)).toList();
    }

    /**
     * Splits on the delimiter, trims each part and drops empty ones.
     */
    protected static List<String> splitCandidates(String text, String delimiter) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(text.split(Pattern.quote(delimiter)))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
