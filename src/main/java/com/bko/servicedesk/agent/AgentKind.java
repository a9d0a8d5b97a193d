package com.bko.servicedesk.agent;

public enum AgentKind {
    DATA("data-agent"),
    SUPPORT("support-agent");

    private final String actor;

    AgentKind(String actor) {
        this.actor = actor;
    }

    /**
     * Name used for this agent in the activity log.
     */
    public String actor() {
        return actor;
    }
}
