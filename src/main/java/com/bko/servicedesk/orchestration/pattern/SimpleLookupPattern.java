package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.agent.TaskPayload.CustomerPayload;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;
import com.bko.servicedesk.orchestration.service.AgentDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Direct dispatch: a single customer lookup.
 */
@Component
@RequiredArgsConstructor
public class SimpleLookupPattern implements CoordinationPattern {

    private final AgentDispatcher dispatcher;

    @Override
    public IntentKind handles() {
        return IntentKind.SIMPLE_LOOKUP;
    }

    @Override
    public PatternOutcome execute(OrchestrationRun run) {
        Long customerId = run.context().intent().slots().customerId();
        TaskResult result = dispatcher.dispatch(run,
                AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.forCustomer(customerId)));
        if (result.success()) {
            run.context().resolveCustomer(result.payloadAs(CustomerPayload.class).customer());
        }
        return PatternOutcome.of(List.of(result));
    }
}
