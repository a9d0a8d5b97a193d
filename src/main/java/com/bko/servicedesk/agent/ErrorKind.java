package com.bko.servicedesk.agent;

public enum ErrorKind {
    NOT_FOUND,
    VALIDATION_ERROR,
    UPSTREAM_FAILURE,
    PARTIAL_FAILURE
}
