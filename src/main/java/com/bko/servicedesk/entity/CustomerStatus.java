package com.bko.servicedesk.entity;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum CustomerStatus {
    ACTIVE("active"),
    DISABLED("disabled");

    private final String value;

    CustomerStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CustomerStatus> parse(@Nullable String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst();
    }
}
