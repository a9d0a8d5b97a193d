package com.bko.servicedesk.activity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only trace of one run. Sequence numbers start at 1 and strictly increase.
 */
@Slf4j
public class ActivityLog {

    private final String runId;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final List<LogEntry> entries = new ArrayList<>();

    public ActivityLog(String runId, Clock clock) {
        this.runId = runId;
        this.clock = clock;
    }

    public String runId() {
        return runId;
    }

    public synchronized LogEntry append(String actor, String action, LogOutcome outcome, @Nullable String detail) {
        LogEntry entry = new LogEntry(sequence.incrementAndGet(), clock.instant(), actor, action, outcome,
                detail == null ? "" : detail);
        entries.add(entry);
        if (outcome == LogOutcome.ERROR) {
            log.warn("[{}#{}] {} {}: {}", runId, entry.sequence(), actor, action, entry.detail());
        } else {
            log.info("[{}#{}] {} {}: {}", runId, entry.sequence(), actor, action, entry.detail());
        }
        return entry;
    }

    public LogEntry ok(String actor, String action, @Nullable String detail) {
        return append(actor, action, LogOutcome.OK, detail);
    }

    public LogEntry error(String actor, String action, @Nullable String detail) {
        return append(actor, action, LogOutcome.ERROR, detail);
    }

    public synchronized List<LogEntry> entries() {
        return List.copyOf(entries);
    }
}
