package com.aegis.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * Weighted scoring policy used by reviewers.
 */
public record Rubric(
        String id,
        String name,
        double minScoreToPass,
        List<Criterion> criteria
) {
    public Rubric {
        Objects.requireNonNull(id, "Rubric ID cannot be null");
        name = name != null ? name : id;
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public record Criterion(
            String id,
            String description,
            double weight,
            double passThreshold
    ) {
        public Criterion {
            Objects.requireNonNull(id, "Criterion ID cannot be null");
            if (weight < 0) {
                throw new IllegalArgumentException("Criterion weight cannot be negative: " + id);
            }
        }
    }
}
