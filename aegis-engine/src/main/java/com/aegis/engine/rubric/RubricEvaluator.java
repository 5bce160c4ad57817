package com.aegis.engine.rubric;

import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.EvidenceType;
import com.aegis.core.domain.ReviewResult;
import com.aegis.core.domain.Rubric;
import com.aegis.core.json.CanonicalJson;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Scores a rubric. Stateless apart from the clock.
 * <p>
 * A criterion below its pass threshold fails the review regardless of the
 * aggregate; so does a weighted average below the rubric minimum. Comparisons
 * tolerate floating-point error of {@value #EPSILON}.
 */
public class RubricEvaluator {

    static final double EPSILON = 1e-9;

    private final Clock clock;

    public RubricEvaluator(Clock clock) {
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public RubricEvaluator() {
        this(Clock.systemUTC());
    }

    /**
     * @param scores criterion id to score; absent criteria score 0
     */
    public ReviewResult evaluate(Rubric rubric, Map<String, Double> scores, String reviewerId, String comments) {
        Objects.requireNonNull(rubric, "Rubric cannot be null");
        Objects.requireNonNull(reviewerId, "Reviewer ID cannot be null");
        Map<String, Double> given = scores != null ? scores : Map.of();

        boolean passed = true;
        double weightedSum = 0;
        double totalWeight = 0;
        List<ReviewResult.CriterionScore> criterionScores = new ArrayList<>();

        for (Rubric.Criterion criterion : rubric.criteria()) {
            Double value = given.get(criterion.id());
            double score = value != null ? value : 0.0;
            boolean criterionPassed = !below(score, criterion.passThreshold());
            if (!criterionPassed) {
                passed = false;
            }
            criterionScores.add(new ReviewResult.CriterionScore(criterion.id(), score, criterionPassed));
            weightedSum += score * criterion.weight();
            totalWeight += criterion.weight();
        }

        double totalScore = totalWeight > 0 ? weightedSum / totalWeight : 0.0;
        if (below(totalScore, rubric.minScoreToPass())) {
            passed = false;
        }
        return new ReviewResult(reviewerId, rubric.id(), criterionScores, totalScore, passed, comments,
                clock.instant());
    }

    /**
     * Wraps a review as {@code review} evidence named after its rubric, so
     * gates can require it.
     */
    public Evidence toEvidence(ReviewResult result, String projectId, String runId) {
        Objects.requireNonNull(result, "Review result cannot be null");
        return new Evidence("review_" + UUID.randomUUID(), projectId, runId, result.reviewerId(),
                EvidenceType.REVIEW, result.timestamp(), CanonicalJson.toTree(result),
                Map.of(Evidence.NAME_KEY, result.rubricId()));
    }

    private static boolean below(double value, double threshold) {
        return value < threshold - EPSILON;
    }
}
