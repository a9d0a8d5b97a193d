package com.bko.servicedesk.agent;

import com.bko.servicedesk.tools.CustomerUpdate;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Typed arguments of an {@link AgentTask}. Each operation reads only the fields it needs.
 */
@Builder(toBuilder = true)
public record TaskArguments(
        @Nullable Long customerId,
        @Nullable String status,
        @Nullable Integer limit,
        @Nullable CustomerUpdate update,
        @Nullable String issue,
        @Nullable String priority,
        @Nullable String query,
        @Nullable List<Long> customerIds
) {

    public static TaskArguments none() {
        return TaskArguments.builder().build();
    }

    public static TaskArguments forCustomer(@Nullable Long customerId) {
        return TaskArguments.builder().customerId(customerId).build();
    }
}
