package com.bko.servicedesk.entity;

import jakarta.persistence.PrePersist;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Stamps {@code updatedAt} on new customers from the application clock, the same one the tool
 * registry advances it with. Hibernate obtains the instance through Spring, so the clock bean is injected.
 */
public class CustomerTimestampListener {

    private final Clock clock;

    public CustomerTimestampListener(ObjectProvider<Clock> clock) {
        this.clock = clock.getIfAvailable(Clock::systemUTC);
    }

    @PrePersist
    void initUpdatedAt(Customer customer) {
        if (customer.getUpdatedAt() == null) {
            customer.setUpdatedAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS));
        }
    }
}
