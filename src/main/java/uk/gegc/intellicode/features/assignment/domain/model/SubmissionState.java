package uk.gegc.intellicode.features.assignment.domain.model;

/**
 * Lifecycle position of the (assignment, student) pair. {@code NONE} means no
 * submission row exists.
 */
public enum SubmissionState {
    NONE,
    SUBMITTED,
    GRADED;

    public static SubmissionState of(Submission submission) {
        if (submission == null) {
            return NONE;
        }
        return submission.getStatus() == SubmissionStatus.GRADED ? GRADED : SUBMITTED;
    }
}
