package com.bko.servicedesk.agent;

import com.bko.servicedesk.tools.CustomerOpenTickets;
import com.bko.servicedesk.tools.CustomerRecord;
import com.bko.servicedesk.tools.TicketRecord;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Structured result data of a successful task.
 */
public sealed interface TaskPayload {

    record CustomerPayload(CustomerRecord customer) implements TaskPayload {
    }

    record CustomerListPayload(List<CustomerRecord> customers) implements TaskPayload {
    }

    record TicketHistoryPayload(CustomerRecord customer, List<TicketRecord> tickets) implements TaskPayload {
    }

    record OpenTicketPortfolioPayload(List<CustomerOpenTickets> customers) implements TaskPayload {
    }

    record PriorityTicketsPayload(String priority, List<TicketRecord> tickets) implements TaskPayload {
    }

    record TicketPayload(TicketRecord ticket, UrgencyAssessment urgency) implements TaskPayload {
    }

    record SupportReplyPayload(@Nullable CustomerRecord customer, UrgencyAssessment urgency) implements TaskPayload {
    }

    record EscalationPayload(TicketRecord ticket, UrgencyAssessment urgency) implements TaskPayload {
    }
}
