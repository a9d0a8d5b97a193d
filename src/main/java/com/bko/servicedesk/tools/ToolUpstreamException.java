package com.bko.servicedesk.tools;

/**
 * The backing store failed for infrastructure reasons.
 */
public class ToolUpstreamException extends ToolRegistryException {

    public ToolUpstreamException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
