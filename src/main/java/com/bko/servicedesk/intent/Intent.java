package com.bko.servicedesk.intent;

import org.springframework.lang.Nullable;

/**
 * Classification outcome of one query. Created once per run and never changed afterwards.
 */
public record Intent(IntentKind kind, IntentSlots slots, String matchedRule, @Nullable String urgencyKeyword) {

    public static final String NO_RULE = "none";

    public boolean highUrgency() {
        return kind == IntentKind.ESCALATION || urgencyKeyword != null;
    }

    /**
     * Whether a customer record has to be resolved before support can answer.
     */
    public boolean requiresCustomerContext() {
        return slots.hasCustomerReference()
                && (kind == IntentKind.NEGOTIATION || kind == IntentKind.ESCALATION);
    }
}
