package com.bko.servicedesk.tools;

public class ToolValidationException extends ToolRegistryException {

    public ToolValidationException(String operation, String message) {
        super(operation, message);
    }
}
