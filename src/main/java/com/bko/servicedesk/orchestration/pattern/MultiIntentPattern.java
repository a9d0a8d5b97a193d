package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;
import com.bko.servicedesk.orchestration.pattern.Decomposition.RejectedClause;
import com.bko.servicedesk.orchestration.service.AgentDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every decomposed sub-task and keeps each result, so one failing sub-task never hides another's success.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MultiIntentPattern implements CoordinationPattern {

    private final AgentDispatcher dispatcher;
    private final QueryDecomposer decomposer;

    @Override
    public IntentKind handles() {
        return IntentKind.MULTI_INTENT;
    }

    @Override
    public PatternOutcome execute(OrchestrationRun run) {
        Decomposition decomposition = decomposer.plan(run.query().text(), run.context().intent().slots());
        List<AgentTask> tasks = decomposition.tasks();
        if (decomposition.isEmpty()) {
            log.info("Run {}: no sub-tasks recognized, answering with general support", run.runId());
            tasks = List.of(AgentTask.of(TaskOperation.PROVIDE_SUPPORT,
                    TaskArguments.builder().query(run.query().text()).build()));
        }
        run.activityLog().ok(OrchestrationRun.ACTOR, "decompose", tasks.size() + " sub-tasks: "
                + tasks.stream().map(AgentTask::describe).toList()
                + (decomposition.rejected().isEmpty() ? "" : ", " + decomposition.rejected().size() + " rejected"));
        List<TaskResult> results = new ArrayList<>();
        for (AgentTask task : tasks) {
            results.add(dispatcher.dispatch(run, task));
        }
        for (RejectedClause rejected : decomposition.rejected()) {
            results.add(dispatcher.reject(run, rejected.task(), rejected.reason()));
        }
        return PatternOutcome.independent(results);
    }
}
