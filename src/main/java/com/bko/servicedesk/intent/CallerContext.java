package com.bko.servicedesk.intent;

import org.springframework.lang.Nullable;

/**
 * Optional facts the caller already knows about the requester.
 */
public record CallerContext(@Nullable Long customerId, @Nullable String sessionId) {

    private static final CallerContext EMPTY = new CallerContext(null, null);

    public static CallerContext empty() {
        return EMPTY;
    }

    public static CallerContext forCustomer(Long customerId) {
        return new CallerContext(customerId, null);
    }
}
