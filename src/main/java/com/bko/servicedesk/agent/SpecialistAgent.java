package com.bko.servicedesk.agent;

/**
 * A handler for one family of {@link TaskOperation}s. Implementations never throw for store failures,
 * they return a failed {@link TaskResult} instead.
 */
public interface SpecialistAgent {

    AgentKind kind();

    TaskResult handle(AgentTask task, RunContext context);
}
