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
 * Sequential negotiation: the data agent resolves the customer, then the support agent answers with it.
 * A failed resolution ends the run before support is asked.
 */
@Component
@RequiredArgsConstructor
public class NegotiationPattern implements CoordinationPattern {

    private final AgentDispatcher dispatcher;
    private final CustomerResolution customerResolution;

    @Override
    public IntentKind handles() {
        return IntentKind.NEGOTIATION;
    }

    @Override
    public PatternOutcome execute(OrchestrationRun run) {
        List<TaskResult> results = new ArrayList<>();
        TaskResult lookup = customerResolution.resolve(run);
        if (lookup != null) {
            results.add(lookup);
            if (!lookup.success()) {
                return PatternOutcome.of(results);
            }
        }
        results.add(dispatcher.dispatch(run, AgentTask.of(TaskOperation.PROVIDE_SUPPORT,
                TaskArguments.builder().query(run.query().text()).build())));
        return PatternOutcome.of(results);
    }
}
