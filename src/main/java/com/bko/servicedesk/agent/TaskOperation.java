package com.bko.servicedesk.agent;

public enum TaskOperation {
    GET_CUSTOMER(AgentKind.DATA, false),
    LIST_CUSTOMERS(AgentKind.DATA, false),
    UPDATE_CUSTOMER(AgentKind.DATA, true),
    GET_CUSTOMER_HISTORY(AgentKind.DATA, false),
    GET_TICKETS_BY_PRIORITY(AgentKind.DATA, false),
    ACTIVE_CUSTOMERS_WITH_OPEN_TICKETS(AgentKind.DATA, false),
    PRIORITY_TICKETS_FOR_STATUS(AgentKind.DATA, false),
    CREATE_TICKET(AgentKind.SUPPORT, true),
    PROVIDE_SUPPORT(AgentKind.SUPPORT, false),
    ESCALATE(AgentKind.SUPPORT, true);

    private final AgentKind agent;
    private final boolean mutation;

    TaskOperation(AgentKind agent, boolean mutation) {
        this.agent = agent;
        this.mutation = mutation;
    }

    public AgentKind agent() {
        return agent;
    }

    public boolean isMutation() {
        return mutation;
    }
}
