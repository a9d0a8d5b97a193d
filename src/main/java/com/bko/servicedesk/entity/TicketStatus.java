package com.bko.servicedesk.entity;

public enum TicketStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    RESOLVED("resolved");

    private final String value;

    TicketStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
