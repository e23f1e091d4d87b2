package com.phillippitts.factopinion.service.rules;

import java.util.Objects;

/**
 * One additive term of a {@link LogicScore}.
 *
 * @param rule    rule name (see {@link LinguisticRuleScorer} constants)
 * @param trigger the cue phrase or word that fired the rule
 * @param delta   signed contribution
 */
public record RuleContribution(String rule, String trigger, double delta) {

    public RuleContribution {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(trigger, "trigger");
    }
}
