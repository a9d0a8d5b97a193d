package com.bko.servicedesk.intent;

import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Values pulled out of the query text.
 *
 * @param identifiers  every standalone positive integer, in order of appearance
 * @param customerId   the run's customer reference; the caller context wins over the text
 * @param priority     stated ticket priority
 * @param email        first email address
 * @param phone        first phone number
 * @param statusFilter customer status mentioned in the text
 */
public record IntentSlots(
        List<Long> identifiers,
        @Nullable Long customerId,
        @Nullable TicketPriority priority,
        @Nullable String email,
        @Nullable String phone,
        @Nullable CustomerStatus statusFilter
) {

    public IntentSlots {
        identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
    }

    public static IntentSlots empty() {
        return new IntentSlots(List.of(), null, null, null, null, null);
    }

    public boolean hasCustomerReference() {
        return customerId != null;
    }
}
