package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;
import com.bko.servicedesk.orchestration.service.AgentDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default path for unclassified queries: a general support reply that asks for details.
 */
@Component
@RequiredArgsConstructor
public class FallbackPattern implements CoordinationPattern {

    private final AgentDispatcher dispatcher;

    @Override
    public IntentKind handles() {
        return IntentKind.UNKNOWN;
    }

    @Override
    public PatternOutcome execute(OrchestrationRun run) {
        return PatternOutcome.of(List.of(dispatcher.dispatch(run, AgentTask.of(TaskOperation.PROVIDE_SUPPORT,
                TaskArguments.builder().query(run.query().text()).build()))));
    }
}
