package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.agent.TaskPayload.CustomerPayload;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.service.AgentDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Resolves the run's customer reference into the run context through the data agent.
 */
@Component
@RequiredArgsConstructor
public class CustomerResolution {

    private final AgentDispatcher dispatcher;

    /**
     * @return the lookup result, or {@code null} when the query carries no customer reference
     */
    @Nullable
    public TaskResult resolve(OrchestrationRun run) {
        if (!run.context().intent().requiresCustomerContext()) {
            return null;
        }
        Long customerId = run.context().intent().slots().customerId();
        TaskResult result = dispatcher.dispatch(run,
                AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.forCustomer(customerId)));
        if (result.success()) {
            run.context().resolveCustomer(result.payloadAs(CustomerPayload.class).customer());
        }
        return result;
    }
}
