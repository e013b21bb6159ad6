package com.gomflow.smartagent.decision;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.matching.PaymentMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DecisionEngine {

    private final DecisionTable table;

    public DecisionEngine(SmartAgentProperties properties) {
        this(DecisionTable.standard(DecisionThresholds.from(properties.getDecision())));
    }

    DecisionEngine(DecisionTable table) {
        this.table = table;
    }

    public DecisionTable.Verdict decide(PaymentExtraction extraction, PaymentMatch match) {
        return evaluate(DecisionInput.of(extraction, match));
    }

    public DecisionTable.Verdict evaluate(DecisionInput input) {
        DecisionTable.Verdict verdict = table.evaluate(input);
        log.debug("Decision rule '{}' -> {} {} (confidence={}, match={})", verdict.ruleName(), verdict.outcome(),
                verdict.reasonCodes(), input.confidence(), input.matchStatus());
        return verdict;
    }
}
