package com.bko.servicedesk.agent;

import com.bko.servicedesk.entity.TicketPriority;

public enum Urgency {
    LOW(TicketPriority.LOW),
    MEDIUM(TicketPriority.MEDIUM),
    HIGH(TicketPriority.HIGH);

    private final TicketPriority ticketPriority;

    Urgency(TicketPriority ticketPriority) {
        this.ticketPriority = ticketPriority;
    }

    public TicketPriority ticketPriority() {
        return ticketPriority;
    }
}
