package com.bko.servicedesk.intent;

public enum IntentKind {
    SIMPLE_LOOKUP("Simple lookup"),
    NEGOTIATION("Negotiation"),
    MULTI_STEP("Multi-step"),
    ESCALATION("Escalation"),
    MULTI_INTENT("Multi-intent"),
    UNKNOWN("Unknown");

    private final String label;

    IntentKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
