package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.intent.IntentSlots;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;
import com.bko.servicedesk.orchestration.service.AgentDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Multi-step aggregation handled by one composite data agent operation.
 */
@Component
@RequiredArgsConstructor
public class MultiStepPattern implements CoordinationPattern {

    private final AgentDispatcher dispatcher;

    @Override
    public IntentKind handles() {
        return IntentKind.MULTI_STEP;
    }

    @Override
    public PatternOutcome execute(OrchestrationRun run) {
        AgentTask task = plan(run.query().text(), run.context().intent().slots());
        return PatternOutcome.of(List.of(dispatcher.dispatch(run, task)));
    }

    static AgentTask plan(String queryText, IntentSlots slots) {
        String text = queryText.toLowerCase(Locale.ROOT);
        CustomerStatus status = slots.statusFilter() != null ? slots.statusFilter() : CustomerStatus.ACTIVE;
        boolean mentionsPriority = slots.priority() != null
                || text.contains("high-priority") || text.contains("priority tickets");
        if (mentionsPriority) {
            TicketPriority priority = slots.priority() != null ? slots.priority() : TicketPriority.HIGH;
            return AgentTask.of(TaskOperation.PRIORITY_TICKETS_FOR_STATUS, TaskArguments.builder()
                    .status(status.value())
                    .priority(priority.value())
                    .build());
        }
        if (text.contains("ticket")) {
            return AgentTask.of(TaskOperation.ACTIVE_CUSTOMERS_WITH_OPEN_TICKETS, TaskArguments.builder()
                    .status(status.value())
                    .build());
        }
        // "all customers" lists every status unless one is named
        String statusFilter = slots.statusFilter() != null ? slots.statusFilter().value() : null;
        if (statusFilter == null && !text.contains("all customers")) {
            statusFilter = CustomerStatus.ACTIVE.value();
        }
        return AgentTask.of(TaskOperation.LIST_CUSTOMERS, TaskArguments.builder().status(statusFilter).build());
    }
}
