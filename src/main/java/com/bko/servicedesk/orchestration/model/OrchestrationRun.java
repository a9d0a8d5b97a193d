package com.bko.servicedesk.orchestration.model;

import com.bko.servicedesk.activity.ActivityLog;
import com.bko.servicedesk.agent.RunContext;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.Intent;
import org.springframework.lang.Nullable;

/**
 * One query from receipt to response.
 */
public class OrchestrationRun {

    public static final String ACTOR = "orchestrator";

    private final String runId;
    private final CustomerQuery query;
    private final ActivityLog activityLog;
    private RunState state = RunState.RECEIVED;
    @Nullable
    private RunContext context;

    public OrchestrationRun(String runId, CustomerQuery query, ActivityLog activityLog) {
        this.runId = runId;
        this.query = query;
        this.activityLog = activityLog;
    }

    public String runId() {
        return runId;
    }

    public CustomerQuery query() {
        return query;
    }

    public ActivityLog activityLog() {
        return activityLog;
    }

    public RunState state() {
        return state;
    }

    public void classified(Intent intent) {
        if (context != null) {
            throw new IllegalStateException("Run " + runId + " is already classified");
        }
        transitionTo(RunState.CLASSIFIED, intent.kind() + " via rule '" + intent.matchedRule() + "'");
        context = new RunContext(query, intent);
    }

    public RunContext context() {
        if (context == null) {
            throw new IllegalStateException("Run " + runId + " has not been classified yet");
        }
        return context;
    }

    @Nullable
    public Intent intentOrNull() {
        return context == null ? null : context.intent();
    }

    public void transitionTo(RunState next, @Nullable String detail) {
        RunState previous = state;
        state = RunStateTransition.transition(previous, next);
        String message = previous + " -> " + next + (detail == null ? "" : ": " + detail);
        if (next == RunState.FAILED) {
            activityLog.error(ACTOR, "transition", message);
        } else {
            activityLog.ok(ACTOR, "transition", message);
        }
    }
}
