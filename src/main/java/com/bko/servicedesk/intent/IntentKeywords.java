package com.bko.servicedesk.intent;

import java.util.List;

public final class IntentKeywords {

    private IntentKeywords() {
        // Private constructor to prevent instantiation
    }

    // Rule names, in evaluation order
    public static final String RULE_URGENT_BILLING = "urgent-billing";
    public static final String RULE_CUSTOMER_LOOKUP = "customer-lookup";
    public static final String RULE_MULTIPLE_ACTIONS = "multiple-actions";
    public static final String RULE_PORTFOLIO_ANALYSIS = "portfolio-analysis";
    public static final String RULE_ASSISTED_SUPPORT = "assisted-support";

    public static final List<String> ESCALATION_PHRASES = List.of(
            "charged twice",
            "double charged",
            "refund immediately",
            "urgent",
            "emergency",
            "immediately",
            "critical",
            "security breach",
            "fraud"
    );

    public static final List<String> LOOKUP_PHRASES = List.of(
            "get customer",
            "customer information",
            "show customer",
            "customer details",
            "look up customer",
            "lookup customer"
    );

    // Any of these turns a lookup phrase into a support request
    public static final List<String> SUPPORT_WORDS = List.of("help", "support", "upgrade", "issue", "problem");

    public static final List<String> ACTION_VERBS = List.of("update", "show", "get", "create", "list", "change");
    public static final int MIN_DISTINCT_ACTIONS = 2;

    public static final List<String> PORTFOLIO_PHRASES = List.of(
            "all customers",
            "active customers",
            "open tickets",
            "high-priority tickets",
            "high priority tickets"
    );

    public static final List<String> ASSISTED_SUPPORT_PHRASES = List.of(
            "help",
            "support",
            "upgrade",
            "cancel",
            "issue",
            "problem",
            "not working",
            "broken",
            "refund",
            "charge"
    );

    // Urgency assessment of the support agent
    public static final List<String> HIGH_URGENCY_PHRASES = List.of(
            "urgent",
            "immediately",
            "critical",
            "emergency",
            "down",
            "charged twice",
            "double charged",
            "refund",
            "security",
            "breach",
            "fraud"
    );

    public static final List<String> MEDIUM_URGENCY_PHRASES = List.of(
            "issue",
            "problem",
            "not working",
            "broken",
            "help"
    );
}
