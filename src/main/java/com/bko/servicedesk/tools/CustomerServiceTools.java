package com.bko.servicedesk.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Exposes the {@link ToolRegistry} operations as tool callbacks. Registry failures are turned into
 * {@code success=false} replies instead of being thrown at the calling model.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerServiceTools {

    private final ToolRegistry toolRegistry;

    @Tool(name = ToolRegistry.GET_CUSTOMER, description = "Retrieve a specific customer by ID")
    public ToolReply getCustomer(@ToolParam(description = "The unique customer ID") Long customerId) {
        return call(ToolRegistry.GET_CUSTOMER, () -> toolRegistry.getCustomer(customerId));
    }

    @Tool(name = ToolRegistry.LIST_CUSTOMERS, description = "List customers ordered by ID, optionally filtered by status")
    public ToolReply listCustomers(
            @ToolParam(description = "Filter by status: active or disabled", required = false) @Nullable String status,
            @ToolParam(description = "Maximum number of customers to return", required = false) @Nullable Integer limit) {
        return call(ToolRegistry.LIST_CUSTOMERS, () -> toolRegistry.listCustomers(status, limit));
    }

    @Tool(name = ToolRegistry.UPDATE_CUSTOMER, description = "Update customer information (name, email, phone or status)")
    public ToolReply updateCustomer(
            @ToolParam(description = "The unique customer ID") Long customerId,
            @ToolParam(description = "New name", required = false) @Nullable String name,
            @ToolParam(description = "New email address", required = false) @Nullable String email,
            @ToolParam(description = "New phone number", required = false) @Nullable String phone,
            @ToolParam(description = "New status: active or disabled", required = false) @Nullable String status) {
        return call(ToolRegistry.UPDATE_CUSTOMER,
                () -> toolRegistry.updateCustomer(customerId, new CustomerUpdate(name, email, phone, status)));
    }

    @Tool(name = ToolRegistry.CREATE_TICKET, description = "Create a new support ticket for a customer")
    public ToolReply createTicket(
            @ToolParam(description = "The customer ID") Long customerId,
            @ToolParam(description = "Description of the issue") String issue,
            @ToolParam(description = "Ticket priority: low, medium or high", required = false) @Nullable String priority) {
        return call(ToolRegistry.CREATE_TICKET, () -> toolRegistry.createTicket(customerId, issue, priority));
    }

    @Tool(name = ToolRegistry.GET_CUSTOMER_HISTORY, description = "Get all tickets of a customer, newest first")
    public ToolReply getCustomerHistory(@ToolParam(description = "The customer ID") Long customerId) {
        return call(ToolRegistry.GET_CUSTOMER_HISTORY, () -> toolRegistry.getCustomerHistory(customerId));
    }

    @Tool(name = ToolRegistry.GET_TICKETS_BY_PRIORITY,
            description = "Get tickets with the given priority, optionally restricted to some customers")
    public ToolReply getTicketsByPriority(
            @ToolParam(description = "Ticket priority: low, medium or high") String priority,
            @ToolParam(description = "Customer IDs to restrict the search to", required = false) @Nullable List<Long> customerIds) {
        return call(ToolRegistry.GET_TICKETS_BY_PRIORITY, () -> toolRegistry.getTicketsByPriority(priority, customerIds));
    }

    @Tool(name = ToolRegistry.GET_CUSTOMERS_WITH_OPEN_TICKETS,
            description = "Get customers that have open tickets, ordered by open ticket count")
    public ToolReply getCustomersWithOpenTickets() {
        return call(ToolRegistry.GET_CUSTOMERS_WITH_OPEN_TICKETS, toolRegistry::getCustomersWithOpenTickets);
    }

    private ToolReply call(String toolName, Supplier<Object> operation) {
        try {
            return ToolReply.ok(operation.get());
        } catch (ToolRegistryException ex) {
            log.warn("Tool {} failed: {}", toolName, ex.getMessage());
            return ToolReply.failed(ex.getMessage());
        }
    }
}
