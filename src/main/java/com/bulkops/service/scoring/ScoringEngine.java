package com.bulkops.service.scoring;

import com.bulkops.model.Finding;
import com.bulkops.model.OperationOutcome;
import com.bulkops.model.OperationPlan;
import com.bulkops.model.Rating;
import com.bulkops.model.RubricCategory;
import com.bulkops.model.ScoreReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a plan, and optionally its outcome, against a rubric.
 *
 * Deltas are summed per category, each category is clamped to [0, max], and the total
 * is the sum of the clamped scores. The rating is informational; it never blocks execution.
 */
@Service
@Slf4j
public class ScoringEngine {

    private final List<ScoringRule> rules;

    @Autowired
    public ScoringEngine(DefaultRubric rubric) {
        this(rubric.rules());
    }

    public ScoringEngine(List<ScoringRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @param outcome null for a pre-execution check
     */
    public ScoreReport score(OperationPlan plan, OperationOutcome outcome) {
        Map<RubricCategory, Integer> raw = new EnumMap<>(RubricCategory.class);
        for (RubricCategory category : RubricCategory.values()) {
            raw.put(category, 0);
        }
        List<Finding> findings = new ArrayList<>();
        for (ScoringRule rule : rules) {
            int delta = rule.score(plan, outcome);
            if (delta != 0) {
                raw.merge(rule.category(), delta, Integer::sum);
                findings.add(new Finding(rule.id(), rule.category(), delta, rule.message()));
            }
        }

        Map<RubricCategory, Integer> clamped = new EnumMap<>(RubricCategory.class);
        int total = 0;
        for (Map.Entry<RubricCategory, Integer> entry : raw.entrySet()) {
            int score = entry.getKey().clamp(entry.getValue());
            clamped.put(entry.getKey(), score);
            total += score;
        }
        Rating rating = Rating.forTotal(total);
        log.debug("Scored {} on {} ({}): {}/{} {}", plan.kind(), plan.objectName(),
                outcome == null ? "pre-execution" : "post-execution", total, RubricCategory.totalMax(), rating);
        return new ScoreReport(clamped, total, rating, findings);
    }
}
