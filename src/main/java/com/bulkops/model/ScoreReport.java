package com.bulkops.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of scoring a plan, optionally against its outcome.
 * The total is always the sum of the clamped category scores.
 */
public record ScoreReport(
    Map<RubricCategory, Integer> categoryScores,
    int total,
    Rating rating,
    List<Finding> findings
) {
    public ScoreReport {
        categoryScores = Collections.unmodifiableMap(new EnumMap<>(categoryScores));
        findings = List.copyOf(findings);
    }

    public int score(RubricCategory category) {
        return categoryScores.getOrDefault(category, 0);
    }
}
