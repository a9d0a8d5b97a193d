package com.bko.servicedesk.tools;

import com.bko.servicedesk.entity.Ticket;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.entity.TicketStatus;

import java.time.OffsetDateTime;

public record TicketRecord(
        Long id,
        Long customerId,
        String customerName,
        String issue,
        TicketStatus status,
        TicketPriority priority,
        OffsetDateTime createdAt
) {

    public static TicketRecord from(Ticket ticket) {
        return new TicketRecord(ticket.getId(), ticket.getCustomer().getId(), ticket.getCustomer().getName(),
                ticket.getIssue(), ticket.getStatus(), ticket.getPriority(), ticket.getCreatedAt());
    }
}
