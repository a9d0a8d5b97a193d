package com.bko.servicedesk.orchestration.model;

import com.bko.servicedesk.activity.LogEntry;
import com.bko.servicedesk.agent.ErrorInfo;
import com.bko.servicedesk.agent.ErrorKind;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.intent.IntentKind;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Complete answer to one query. {@code success} is true only when the run completed without errors.
 */
public record OrchestrationResponse(
        String runId,
        boolean success,
        String text,
        @Nullable IntentKind patternUsed,
        List<LogEntry> trace,
        List<ErrorInfo> errors,
        boolean escalated,
        RunState finalState,
        @Nullable ErrorKind failureKind,
        List<TaskResult> results
) {

    public OrchestrationResponse {
        trace = List.copyOf(trace);
        errors = List.copyOf(errors);
        results = List.copyOf(results);
    }
}
