package com.bko.servicedesk.orchestration.model;

import com.bko.servicedesk.agent.TaskResult;

import java.util.List;

/**
 * Results produced by one coordination pattern, in dispatch order.
 *
 * @param results       every agent result of the run
 * @param escalated     whether the run went through escalation
 * @param independent   whether results were collected independently, so a mix of successes and failures
 *                      is reported as a partial failure
 */
public record PatternOutcome(List<TaskResult> results, boolean escalated, boolean independent) {

    public PatternOutcome {
        results = List.copyOf(results);
    }

    public static PatternOutcome of(List<TaskResult> results) {
        return new PatternOutcome(results, false, false);
    }

    public static PatternOutcome escalated(List<TaskResult> results) {
        return new PatternOutcome(results, true, false);
    }

    public static PatternOutcome independent(List<TaskResult> results) {
        return new PatternOutcome(results, false, true);
    }
}
