package com.bko.servicedesk.tools;

/**
 * Base type for every failure raised by {@link ToolRegistry}.
 */
public abstract class ToolRegistryException extends RuntimeException {

    private final String operation;

    protected ToolRegistryException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    protected ToolRegistryException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
