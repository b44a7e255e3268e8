package uk.gegc.intellicode.features.assignment.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.intellicode.features.assignment.domain.model.AssignmentSubtype;
import uk.gegc.intellicode.features.assignment.domain.model.Submission;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionState;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionStatus;
import uk.gegc.intellicode.shared.result.Result;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionStateMachineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 10, 0);

    private final SubmissionStateMachine stateMachine = new SubmissionStateMachine();
    private UUID studentId;
    private Submission submission;

    @BeforeEach
    void setUp() {
        studentId = UUID.randomUUID();
        submission = new Submission();
        submission.setId(UUID.randomUUID());
        submission.setStudentId(studentId);
        submission.setMaxScore(10);
        submission.setStatus(SubmissionStatus.SUBMITTED);
    }

    @Nested
    class Submit {

        @Test
        @DisplayName("allowed only from NONE")
        void onlyFromNone() {
            assertThat(stateMachine.checkSubmit(SubmissionState.NONE).isOk()).isTrue();
            assertThat(stateMachine.checkSubmit(SubmissionState.SUBMITTED).getError().error())
                    .isEqualTo(SubmissionError.DUPLICATE_SUBMISSION);
            assertThat(stateMachine.checkSubmit(SubmissionState.GRADED).getError().error())
                    .isEqualTo(SubmissionError.DUPLICATE_SUBMISSION);
        }
    }

    @Nested
    class Grade {

        @Test
        @DisplayName("mark as graded sets GRADED and the graded timestamp")
        void markAsGraded() {
            Result<Submission, SubmissionFailure> result = stateMachine.applyGrade(submission, 7, "Nice work", true, NOW);

            assertThat(result.isOk()).isTrue();
            assertThat(submission.getScore()).isEqualTo(7);
            assertThat(submission.getFeedback()).isEqualTo("Nice work");
            assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.GRADED);
            assertThat(submission.getGradedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("without the flag a graded submission goes back to SUBMITTED")
        void regradeWithoutFlag() {
            stateMachine.applyGrade(submission, 7, null, true, NOW);

            stateMachine.applyGrade(submission, 5, null, false, NOW.plusHours(1));

            assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.SUBMITTED);
            assertThat(submission.getGradedAt()).isNull();
            assertThat(submission.getScore()).isEqualTo(5);
        }

        @Test
        @DisplayName("grading twice with the same input gives the same state")
        void idempotent() {
            stateMachine.applyGrade(submission, 8, "ok", true, NOW);
            stateMachine.applyGrade(submission, 8, "ok", true, NOW);

            assertThat(submission.getScore()).isEqualTo(8);
            assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.GRADED);
            assertThat(submission.getGradedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("null feedback keeps the previous feedback")
        void keepsFeedback() {
            submission.setFeedback("first");

            stateMachine.applyGrade(submission, 3, null, false, NOW);

            assertThat(submission.getFeedback()).isEqualTo("first");
        }

        @Test
        @DisplayName("score outside 0..max is rejected")
        void scoreOutOfRange() {
            Result<Submission, SubmissionFailure> tooHigh = stateMachine.applyGrade(submission, 11, null, true, NOW);
            Result<Submission, SubmissionFailure> negative = stateMachine.applyGrade(submission, -1, null, true, NOW);

            assertThat(tooHigh.getError().error()).isEqualTo(SubmissionError.SCORE_OUT_OF_RANGE);
            assertThat(tooHigh.getError().message()).isEqualTo("Score must be between 0 and 10");
            assertThat(negative.getError().error()).isEqualTo(SubmissionError.SCORE_OUT_OF_RANGE);
            assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.SUBMITTED);
        }

        @Test
        @DisplayName("no submission cannot be graded")
        void missingSubmission() {
            assertThat(stateMachine.applyGrade(null, 1, null, true, NOW).getError().error())
                    .isEqualTo(SubmissionError.SUBMISSION_NOT_FOUND);
        }
    }

    @Nested
    class Undo {

        @Test
        @DisplayName("student may undo an ungraded file upload")
        void studentUndoFileUpload() {
            UndoActor student = new UndoActor(studentId, false, false);

            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.FILE_UPLOAD, studentId, student).isOk())
                    .isTrue();
        }

        @Test
        @DisplayName("student cannot undo a graded submission")
        void studentUndoGraded() {
            submission.setStatus(SubmissionStatus.GRADED);
            UndoActor student = new UndoActor(studentId, false, false);

            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.FILE_UPLOAD, studentId, student)
                    .getError().error()).isEqualTo(SubmissionError.ALREADY_GRADED);
        }

        @Test
        @DisplayName("student cannot undo quiz or code submissions")
        void studentUndoOtherSubtype() {
            UndoActor student = new UndoActor(studentId, false, false);

            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.QUIZ_FORM, studentId, student)
                    .getError().error()).isEqualTo(SubmissionError.UNDO_NOT_ALLOWED);
            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.CODE_SANDBOX, studentId, student)
                    .getError().error()).isEqualTo(SubmissionError.UNDO_NOT_ALLOWED);
        }

        @Test
        @DisplayName("student cannot undo another student's submission, even a missing one")
        void studentUndoOther() {
            UndoActor other = new UndoActor(UUID.randomUUID(), false, false);

            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.FILE_UPLOAD, studentId, other)
                    .getError().error()).isEqualTo(SubmissionError.NOT_SUBMISSION_OWNER);
            assertThat(stateMachine.checkUndo(null, AssignmentSubtype.FILE_UPLOAD, studentId, other)
                    .getError().error()).isEqualTo(SubmissionError.NOT_SUBMISSION_OWNER);
        }

        @Test
        @DisplayName("course instructor may undo any state and subtype")
        void instructorUndo() {
            submission.setStatus(SubmissionStatus.GRADED);
            UndoActor instructor = new UndoActor(UUID.randomUUID(), true, true);

            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.QUIZ_FORM, studentId, instructor).isOk())
                    .isTrue();
        }

        @Test
        @DisplayName("teacher of another course is refused")
        void foreignTeacher() {
            UndoActor teacher = new UndoActor(UUID.randomUUID(), true, false);

            assertThat(stateMachine.checkUndo(submission, AssignmentSubtype.FILE_UPLOAD, studentId, teacher)
                    .getError().error()).isEqualTo(SubmissionError.NOT_COURSE_INSTRUCTOR);
        }

        @Test
        @DisplayName("nothing to undo reports NO_SUBMISSION")
        void nothingToUndo() {
            UndoActor instructor = new UndoActor(UUID.randomUUID(), true, true);

            assertThat(stateMachine.checkUndo(null, AssignmentSubtype.FILE_UPLOAD, studentId, instructor)
                    .getError().error()).isEqualTo(SubmissionError.NO_SUBMISSION);
        }
    }
}
