package com.bulkops.service.scoring;

import com.bulkops.model.OperationOutcome;
import com.bulkops.model.OperationPlan;
import com.bulkops.model.RubricCategory;

import java.util.function.BiPredicate;

/**
 * One rubric rule: a pure function of a plan and, when available, its outcome.
 */
public interface ScoringRule {

    String id();

    RubricCategory category();

    String message();

    /**
     * @param outcome null before execution
     * @return points contributed, 0 when the rule does not fire
     */
    int score(OperationPlan plan, OperationOutcome outcome);

    /**
     * Rule that contributes {@code delta} whenever {@code condition} holds.
     */
    static ScoringRule when(String id, RubricCategory category, int delta, String message,
                            BiPredicate<OperationPlan, OperationOutcome> condition) {
        return new ConditionalRule(id, category, delta, message, condition);
    }

    record ConditionalRule(String id, RubricCategory category, int delta, String message,
                           BiPredicate<OperationPlan, OperationOutcome> condition) implements ScoringRule {

        @Override
        public int score(OperationPlan plan, OperationOutcome outcome) {
            return condition.test(plan, outcome) ? delta : 0;
        }
    }
}
