package com.bko.servicedesk.orchestration.model;

/**
 * Allowed moves of the run state machine. Every non-terminal state may fail; terminal states are final.
 */
public final class RunStateTransition {

    private RunStateTransition() {
        // Private constructor to prevent instantiation
    }

    public static void validate(RunState from, RunState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException("Cannot transition from terminal state: " + from + " -> " + to);
        }
        if (to == RunState.FAILED) {
            return;
        }
        boolean valid = switch (from) {
            case RECEIVED -> to == RunState.CLASSIFIED;
            case CLASSIFIED -> to == RunState.DISPATCHING;
            case DISPATCHING -> to == RunState.AGGREGATING;
            case AGGREGATING -> to == RunState.COMPLETED;
            case COMPLETED, FAILED -> false;
        };
        if (!valid) {
            throw new IllegalStateException("Invalid state transition: " + from + " -> " + to);
        }
    }

    public static RunState transition(RunState current, RunState next) {
        validate(current, next);
        return next;
    }
}
