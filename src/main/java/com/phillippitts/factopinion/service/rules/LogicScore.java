package com.phillippitts.factopinion.service.rules;

import java.util.List;

/**
 * Signed, unbounded rule score for one sentence together with the rules that produced it.
 * Positive values lean towards fact, negative towards opinion.
 *
 * @param value         sum of all contributions
 * @param contributions applied rules in evaluation order
 */
public record LogicScore(double value, List<RuleContribution> contributions) {

    public LogicScore {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public static LogicScore of(List<RuleContribution> contributions) {
        double sum = 0.0;
        for (RuleContribution c : contributions) {
            sum += c.delta();
        }
        return new LogicScore(sum, contributions);
    }
}
