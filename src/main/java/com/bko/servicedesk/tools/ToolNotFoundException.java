package com.bko.servicedesk.tools;

public class ToolNotFoundException extends ToolRegistryException {

    public ToolNotFoundException(String operation, String message) {
        super(operation, message);
    }

    public static ToolNotFoundException customer(String operation, Long customerId) {
        return new ToolNotFoundException(operation, "Customer " + customerId + " not found");
    }
}
