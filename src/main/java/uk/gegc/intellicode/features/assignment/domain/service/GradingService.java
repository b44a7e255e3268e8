package uk.gegc.intellicode.features.assignment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.intellicode.features.assignment.domain.grading.AnswerInput;
import uk.gegc.intellicode.features.assignment.domain.grading.GradeResult;
import uk.gegc.intellicode.features.assignment.domain.grading.GradedAnswer;
import uk.gegc.intellicode.features.assignment.domain.grading.GradingOutcome;
import uk.gegc.intellicode.features.assignment.domain.model.Assignment;
import uk.gegc.intellicode.features.assignment.domain.model.Question;
import uk.gegc.intellicode.features.assignment.infra.grading.QuestionGraderFactory;
import uk.gegc.intellicode.shared.result.Result;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Grades a whole quiz submission. Either every answer is graded or the
 * submission is rejected; there is no partial outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GradingService {

    private final QuestionGraderFactory graderFactory;

    public Result<GradingOutcome, SubmissionFailure> grade(Assignment assignment, List<AnswerInput> answers) {
        Map<UUID, Question> questions = assignment.getQuestions().stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));

        Set<UUID> seen = new HashSet<>();
        List<GradedAnswer> graded = new ArrayList<>(answers.size());
        int score = 0;

        for (AnswerInput answer : answers) {
            Question question = questions.get(answer.questionId());
            if (question == null) {
                log.debug("Answer references question {} outside assignment {}", answer.questionId(), assignment.getId());
                return Result.err(SubmissionFailure.of(SubmissionError.UNKNOWN_QUESTION,
                        "Question " + answer.questionId() + " does not belong to this assignment"));
            }
            if (!seen.add(question.getId())) {
                return Result.err(SubmissionFailure.of(SubmissionError.DUPLICATE_ANSWER));
            }
            GradeResult result = graderFactory.getGrader(question.getType()).grade(question, answer.answerText());
            graded.add(new GradedAnswer(answer.answerText(), result));
            score += result.pointsEarned();
        }

        return Result.ok(new GradingOutcome(graded, score, assignment.maxScore()));
    }
}
