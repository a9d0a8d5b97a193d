package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;
import com.bko.servicedesk.orchestration.service.AgentDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Negotiation followed by a forced high-priority ticket. The escalation step always runs so the customer
 * gets an acknowledgment even when their account could not be resolved.
 */
@Component
@RequiredArgsConstructor
public class EscalationPattern implements CoordinationPattern {

    private final AgentDispatcher dispatcher;
    private final CustomerResolution customerResolution;

    @Override
    public IntentKind handles() {
        return IntentKind.ESCALATION;
    }

    @Override
    public PatternOutcome execute(OrchestrationRun run) {
        List<TaskResult> results = new ArrayList<>();
        String text = run.query().text();
        TaskResult lookup = customerResolution.resolve(run);
        if (lookup != null) {
            results.add(lookup);
        }
        if (lookup == null || lookup.success()) {
            results.add(dispatcher.dispatch(run, AgentTask.of(TaskOperation.PROVIDE_SUPPORT,
                    TaskArguments.builder().query(text).build())));
        }
        results.add(dispatcher.dispatch(run, AgentTask.of(TaskOperation.ESCALATE,
                TaskArguments.builder().issue(text).build())));
        return PatternOutcome.escalated(results);
    }
}
