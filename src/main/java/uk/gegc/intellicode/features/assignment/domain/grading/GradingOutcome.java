package uk.gegc.intellicode.features.assignment.domain.grading;

import java.util.List;

public record GradingOutcome(List<GradedAnswer> answers, int score, int maxScore) {
}
