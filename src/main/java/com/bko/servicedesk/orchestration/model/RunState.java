package com.bko.servicedesk.orchestration.model;

public enum RunState {
    RECEIVED,
    CLASSIFIED,
    DISPATCHING,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
