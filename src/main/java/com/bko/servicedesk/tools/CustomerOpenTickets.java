package com.bko.servicedesk.tools;

public record CustomerOpenTickets(CustomerRecord customer, long openTicketCount) {
}
