package com.bko.servicedesk.agent;

import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.Intent;
import com.bko.servicedesk.tools.CustomerRecord;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State shared by the agents of one run. Fields can be set once and results only appended.
 */
public class RunContext {

    private final CustomerQuery query;
    private final Intent intent;
    private final List<TaskResult> priorResults = new ArrayList<>();
    @Nullable
    private CustomerRecord resolvedCustomer;
    @Nullable
    private UrgencyAssessment urgency;

    public RunContext(CustomerQuery query, Intent intent) {
        this.query = query;
        this.intent = intent;
    }

    public CustomerQuery query() {
        return query;
    }

    public Intent intent() {
        return intent;
    }

    public synchronized Optional<CustomerRecord> resolvedCustomer() {
        return Optional.ofNullable(resolvedCustomer);
    }

    public synchronized void resolveCustomer(CustomerRecord customer) {
        if (customer == null) {
            throw new IllegalArgumentException("customer is required");
        }
        if (resolvedCustomer != null) {
            throw new IllegalStateException("Customer already resolved for this run: " + resolvedCustomer.id());
        }
        resolvedCustomer = customer;
    }

    public synchronized Optional<UrgencyAssessment> urgency() {
        return Optional.ofNullable(urgency);
    }

    public synchronized void assessUrgency(UrgencyAssessment assessment) {
        if (assessment == null) {
            throw new IllegalArgumentException("assessment is required");
        }
        if (urgency != null) {
            throw new IllegalStateException("Urgency already assessed for this run: " + urgency.urgency());
        }
        urgency = assessment;
    }

    public synchronized void addResult(TaskResult result) {
        priorResults.add(result);
    }

    public synchronized List<TaskResult> priorResults() {
        return List.copyOf(priorResults);
    }
}
