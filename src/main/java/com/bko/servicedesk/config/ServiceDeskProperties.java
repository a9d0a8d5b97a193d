package com.bko.servicedesk.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "service-desk")
public class ServiceDeskProperties {

    /**
     * Deadline for a single specialist agent call. Unset or zero means calls run inline without a deadline.
     */
    private Duration agentTimeout;
    private int defaultListLimit = 10;
    private int maxListLimit = 100;
    private int historyPreviewSize = 5;
    private boolean auditEnabled = true;

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public void setAgentTimeout(Duration agentTimeout) {
        this.agentTimeout = agentTimeout;
    }

    public boolean hasAgentTimeout() {
        return agentTimeout != null && !agentTimeout.isZero() && !agentTimeout.isNegative();
    }

    public int getDefaultListLimit() {
        return defaultListLimit;
    }

    public void setDefaultListLimit(int defaultListLimit) {
        this.defaultListLimit = defaultListLimit;
    }

    public int getMaxListLimit() {
        return maxListLimit;
    }

    public void setMaxListLimit(int maxListLimit) {
        this.maxListLimit = maxListLimit;
    }

    public int getHistoryPreviewSize() {
        return historyPreviewSize;
    }

    public void setHistoryPreviewSize(int historyPreviewSize) {
        this.historyPreviewSize = historyPreviewSize;
    }

    public boolean isAuditEnabled() {
        return auditEnabled;
    }

    public void setAuditEnabled(boolean auditEnabled) {
        this.auditEnabled = auditEnabled;
    }
}
