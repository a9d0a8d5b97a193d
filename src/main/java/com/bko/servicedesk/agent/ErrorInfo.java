package com.bko.servicedesk.agent;

/**
 * @param kind    failure category
 * @param message human-readable explanation
 * @param source  operation that failed
 */
public record ErrorInfo(ErrorKind kind, String message, String source) {
}
