package com.bko.servicedesk.agent;

import com.bko.servicedesk.agent.TaskPayload.CustomerPayload;
import com.bko.servicedesk.agent.TaskPayload.OpenTicketPortfolioPayload;
import com.bko.servicedesk.agent.TaskPayload.PriorityTicketsPayload;
import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.entity.TicketStatus;
import com.bko.servicedesk.intent.CallerContext;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.IntentClassifier;
import com.bko.servicedesk.intent.SlotExtractor;
import com.bko.servicedesk.tools.CustomerOpenTickets;
import com.bko.servicedesk.tools.CustomerRecord;
import com.bko.servicedesk.tools.TicketRecord;
import com.bko.servicedesk.tools.ToolNotFoundException;
import com.bko.servicedesk.tools.ToolRegistry;
import com.bko.servicedesk.tools.ToolUpstreamException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class DataAgentTest {

    private final ToolRegistry toolRegistry = mock(ToolRegistry.class);
    private final DataAgent agent = new DataAgent(toolRegistry, new ServiceDeskProperties());
    private final IntentClassifier classifier = new IntentClassifier(new SlotExtractor());

    private RunContext context(String text) {
        CustomerQuery query = CustomerQuery.of(text);
        return new RunContext(query, classifier.classify(query.text(), CallerContext.empty()));
    }

    private static CustomerRecord customer(long id, String name, CustomerStatus status) {
        OffsetDateTime now = OffsetDateTime.now();
        return new CustomerRecord(id, name, name.toLowerCase() + "@example.com", "555-0100", status, now, now);
    }

    @Test
    void testGetCustomerFormatsRecord() {
        when(toolRegistry.getCustomer(5L)).thenReturn(customer(5L, "Charlie Brown", CustomerStatus.ACTIVE));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.forCustomer(5L)),
                context("Get customer information for ID 5"));

        assertTrue(result.success());
        assertEquals("Charlie Brown", result.payloadAs(CustomerPayload.class).customer().name());
        assertTrue(result.text().contains("Customer Information:"));
        assertTrue(result.text().contains("Status: active"));
    }

    @Test
    void testNotFoundIsForwardedAsResult() {
        when(toolRegistry.getCustomer(anyLong())).thenThrow(ToolNotFoundException.customer(ToolRegistry.GET_CUSTOMER, 9L));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.forCustomer(9L)),
                context("Get customer 9"));

        assertFalse(result.success());
        assertEquals(ErrorKind.NOT_FOUND, result.error().kind());
        assertEquals("GET_CUSTOMER", result.error().source());
    }

    @Test
    void testUpstreamFailureIsForwardedAsResult() {
        when(toolRegistry.getCustomer(anyLong())).thenThrow(
                new ToolUpstreamException(ToolRegistry.GET_CUSTOMER, "Backing store failure", new RuntimeException()));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.forCustomer(1L)),
                context("Get customer 1"));

        assertEquals(ErrorKind.UPSTREAM_FAILURE, result.error().kind());
    }

    @Test
    void testMissingCustomerIdIsValidationError() {
        TaskResult result = agent.handle(AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.none()),
                context("Get customer information"));

        assertEquals(ErrorKind.VALIDATION_ERROR, result.error().kind());
        verifyNoInteractions(toolRegistry);
    }

    @Test
    void testSupportOperationIsRejected() {
        TaskResult result = agent.handle(AgentTask.of(TaskOperation.CREATE_TICKET, TaskArguments.forCustomer(1L)),
                context("Create a ticket"));

        assertFalse(result.success());
        assertEquals(ErrorKind.VALIDATION_ERROR, result.error().kind());
        verifyNoInteractions(toolRegistry);
    }

    @Test
    void testActiveCustomersWithOpenTicketsIntersectsStatus() {
        CustomerRecord alice = customer(1L, "Alice", CustomerStatus.ACTIVE);
        CustomerRecord bob = customer(2L, "Bob", CustomerStatus.DISABLED);
        when(toolRegistry.listCustomers("active", 100)).thenReturn(List.of(alice));
        when(toolRegistry.getCustomersWithOpenTickets()).thenReturn(List.of(
                new CustomerOpenTickets(bob, 3), new CustomerOpenTickets(alice, 2)));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.ACTIVE_CUSTOMERS_WITH_OPEN_TICKETS,
                TaskArguments.builder().status("active").build()), context("Show me all active customers with open tickets"));

        List<CustomerOpenTickets> matching = result.payloadAs(OpenTicketPortfolioPayload.class).customers();
        assertEquals(1, matching.size());
        assertEquals("Alice", matching.get(0).customer().name());
        assertTrue(result.text().contains("Total: 1 customer"));
        assertTrue(result.text().contains("Open Tickets: 2"));
    }

    @Test
    void testPriorityTicketsForStatusChainsCalls() {
        CustomerRecord alice = customer(1L, "Alice", CustomerStatus.ACTIVE);
        TicketRecord ticket = new TicketRecord(10L, 1L, "Alice", "Outage", TicketStatus.OPEN, TicketPriority.HIGH,
                OffsetDateTime.now());
        when(toolRegistry.listCustomers("active", 100)).thenReturn(List.of(alice));
        when(toolRegistry.getTicketsByPriority("high", List.of(1L))).thenReturn(List.of(ticket));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.PRIORITY_TICKETS_FOR_STATUS,
                TaskArguments.builder().status("active").priority("high").build()), context("high-priority tickets"));

        assertTrue(result.success());
        assertEquals(List.of(ticket), result.payloadAs(PriorityTicketsPayload.class).tickets());
        assertTrue(result.text().contains("Ticket #10"));
    }
}
