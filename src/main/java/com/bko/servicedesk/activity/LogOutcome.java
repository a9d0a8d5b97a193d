package com.bko.servicedesk.activity;

public enum LogOutcome {
    OK,
    ERROR
}
