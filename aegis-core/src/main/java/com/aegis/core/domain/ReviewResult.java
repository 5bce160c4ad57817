package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of scoring a rubric.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewResult(
        String reviewerId,
        String rubricId,
        List<CriterionScore> scores,
        double totalScore,
        boolean passed,
        String comments,
        Instant timestamp
) {
    public ReviewResult {
        Objects.requireNonNull(reviewerId, "Reviewer ID cannot be null");
        Objects.requireNonNull(rubricId, "Rubric ID cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        scores = scores != null ? List.copyOf(scores) : List.of();
    }

    public record CriterionScore(String criterionId, double score, boolean passed) {
        public CriterionScore {
            Objects.requireNonNull(criterionId, "Criterion ID cannot be null");
        }
    }
}
