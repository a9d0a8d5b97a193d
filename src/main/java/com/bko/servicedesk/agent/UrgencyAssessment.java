package com.bko.servicedesk.agent;

public record UrgencyAssessment(Urgency urgency, String reason) {

    public boolean isHigh() {
        return urgency == Urgency.HIGH;
    }
}
