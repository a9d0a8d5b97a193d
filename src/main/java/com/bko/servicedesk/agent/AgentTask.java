package com.bko.servicedesk.agent;

public record AgentTask(TaskOperation operation, TaskArguments arguments) {

    public AgentTask {
        if (operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
        arguments = arguments == null ? TaskArguments.none() : arguments;
    }

    public static AgentTask of(TaskOperation operation, TaskArguments arguments) {
        return new AgentTask(operation, arguments);
    }

    public AgentKind agent() {
        return operation.agent();
    }

    public String describe() {
        Long customerId = arguments.customerId();
        return customerId == null ? operation.name() : operation.name() + "(customer " + customerId + ")";
    }
}
