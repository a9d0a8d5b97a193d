package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;

import java.util.List;

/**
 * Sub-tasks of a multi-intent query, plus the clauses that asked for something no agent can do.
 */
public record Decomposition(List<AgentTask> tasks, List<RejectedClause> rejected) {

    public Decomposition {
        tasks = List.copyOf(tasks);
        rejected = List.copyOf(rejected);
    }

    public boolean isEmpty() {
        return tasks.isEmpty() && rejected.isEmpty();
    }

    public record RejectedClause(AgentTask task, String reason) {
    }
}
