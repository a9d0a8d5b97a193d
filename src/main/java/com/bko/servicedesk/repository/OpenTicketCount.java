package com.bko.servicedesk.repository;

/**
 * Projection of a customer id and the number of its open tickets.
 */
public interface OpenTicketCount {

    Long getCustomerId();

    Long getOpenCount();
}
