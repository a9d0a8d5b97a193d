package com.bko.servicedesk.entity;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum TicketPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    TicketPriority(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TicketPriority> parse(@Nullable String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(priority -> priority.value.equals(normalized))
                .findFirst();
    }
}
