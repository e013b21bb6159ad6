package com.gomflow.smartagent.decision;

import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ReasonCode;

import java.util.function.Function;
import java.util.function.Predicate;

public record DecisionRule(
        String name,
        Predicate<DecisionInput> condition,
        DecisionOutcome outcome,
        Function<DecisionInput, ReasonCode> reason
) {

    public static DecisionRule of(String name, Predicate<DecisionInput> condition,
                                  DecisionOutcome outcome, ReasonCode reasonCode) {
        return new DecisionRule(name, condition, outcome, input -> reasonCode);
    }

    public boolean applies(DecisionInput input) {
        return condition.test(input);
    }
}
