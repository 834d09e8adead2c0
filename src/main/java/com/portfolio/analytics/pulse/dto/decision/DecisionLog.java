package com.portfolio.analytics.pulse.dto.decision;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decisions recorded over one review cycle. Ids are handed out sequentially as
 * {@code DEC-001}, {@code DEC-002}, ...
 */
@JsonPropertyOrder({"decisionCount", "decisions"})
public class DecisionLog {

    private final List<Decision> decisions = new ArrayList<>();

    private int counter;

    public String nextId() {
        counter++;
        return String.format("DEC-%03d", counter);
    }

    public void add(Decision decision) {
        decisions.add(decision);
    }

    public List<Decision> getDecisions() {
        return Collections.unmodifiableList(decisions);
    }

    public int getDecisionCount() {
        return decisions.size();
    }
}
