package com.bko.servicedesk.activity;

import java.time.Instant;

public record LogEntry(
        long sequence,
        Instant timestamp,
        String actor,
        String action,
        LogOutcome outcome,
        String detail
) {
}
