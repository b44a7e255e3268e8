package uk.gegc.intellicode.features.assignment.domain.service;

import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.assignment.domain.model.AssignmentSubtype;
import uk.gegc.intellicode.features.assignment.domain.model.Submission;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionState;
import uk.gegc.intellicode.features.assignment.domain.model.SubmissionStatus;
import uk.gegc.intellicode.shared.result.Result;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Permitted transitions of a submission:
 * <pre>
 *   NONE      --submit--&gt; SUBMITTED
 *   SUBMITTED --grade---&gt; SUBMITTED | GRADED
 *   GRADED    --grade---&gt; SUBMITTED | GRADED
 *   SUBMITTED --undo----&gt; NONE
 *   GRADED    --undo----&gt; NONE   (course instructor only)
 * </pre>
 * Student undo is further restricted to file upload assignments.
 */
@Component
public class SubmissionStateMachine {

    public Result<Void, SubmissionFailure> checkSubmit(SubmissionState current) {
        if (current != SubmissionState.NONE) {
            return Result.err(SubmissionFailure.of(SubmissionError.DUPLICATE_SUBMISSION));
        }
        return Result.ok(null);
    }

    /**
     * Applies a manual grade. Re-grading is allowed and produces the same
     * state for the same input.
     */
    public Result<Submission, SubmissionFailure> applyGrade(Submission submission, int score, String feedback,
                                                            boolean markAsGraded, LocalDateTime now) {
        if (SubmissionState.of(submission) == SubmissionState.NONE) {
            return Result.err(SubmissionFailure.of(SubmissionError.SUBMISSION_NOT_FOUND));
        }
        if (score < 0 || score > submission.getMaxScore()) {
            return Result.err(SubmissionFailure.of(SubmissionError.SCORE_OUT_OF_RANGE,
                    "Score must be between 0 and " + submission.getMaxScore()));
        }
        submission.setScore(score);
        if (feedback != null) {
            submission.setFeedback(feedback);
        }
        if (markAsGraded) {
            submission.setStatus(SubmissionStatus.GRADED);
            submission.setGradedAt(now);
        } else {
            submission.setStatus(SubmissionStatus.SUBMITTED);
            submission.setGradedAt(null);
        }
        return Result.ok(submission);
    }

    /**
     * Decides whether {@code actor} may take the student's submission back to
     * {@code NONE}. Permission is checked before existence so students cannot
     * probe other students' submissions.
     */
    public Result<Void, SubmissionFailure> checkUndo(Submission submission, AssignmentSubtype subtype,
                                                     UUID studentId, UndoActor actor) {
        if (actor.teacher()) {
            if (!actor.courseOwner()) {
                return Result.err(SubmissionFailure.of(SubmissionError.NOT_COURSE_INSTRUCTOR));
            }
        } else {
            if (!studentId.equals(actor.userId())) {
                return Result.err(SubmissionFailure.of(SubmissionError.NOT_SUBMISSION_OWNER));
            }
            if (subtype != AssignmentSubtype.FILE_UPLOAD) {
                return Result.err(SubmissionFailure.of(SubmissionError.UNDO_NOT_ALLOWED));
            }
        }

        SubmissionState state = SubmissionState.of(submission);
        if (state == SubmissionState.NONE) {
            return Result.err(SubmissionFailure.of(SubmissionError.NO_SUBMISSION));
        }
        if (!actor.teacher() && state == SubmissionState.GRADED) {
            return Result.err(SubmissionFailure.of(SubmissionError.ALREADY_GRADED));
        }
        return Result.ok(null);
    }
}
