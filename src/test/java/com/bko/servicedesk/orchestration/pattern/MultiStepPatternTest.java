package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.intent.CallerContext;
import com.bko.servicedesk.intent.SlotExtractor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MultiStepPatternTest {

    private final SlotExtractor slotExtractor = new SlotExtractor();

    private AgentTask plan(String text) {
        return MultiStepPattern.plan(text, slotExtractor.extract(text, CallerContext.empty()));
    }

    @Test
    void testOpenTicketPortfolio() {
        AgentTask task = plan("Show me all active customers who have open tickets");
        assertEquals(TaskOperation.ACTIVE_CUSTOMERS_WITH_OPEN_TICKETS, task.operation());
        assertEquals("active", task.arguments().status());
    }

    @Test
    void testPriorityTickets() {
        AgentTask task = plan("What's the status of all high-priority tickets for disabled customers?");
        assertEquals(TaskOperation.PRIORITY_TICKETS_FOR_STATUS, task.operation());
        assertEquals("high", task.arguments().priority());
        assertEquals("disabled", task.arguments().status());
    }

    @Test
    void testAllCustomersListing() {
        AgentTask task = plan("Give me all customers");
        assertEquals(TaskOperation.LIST_CUSTOMERS, task.operation());
        assertNull(task.arguments().status());
    }
}
