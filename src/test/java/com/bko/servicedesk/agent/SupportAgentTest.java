package com.bko.servicedesk.agent;

import com.bko.servicedesk.agent.TaskPayload.EscalationPayload;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.entity.TicketStatus;
import com.bko.servicedesk.intent.CallerContext;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.Intent;
import com.bko.servicedesk.intent.IntentClassifier;
import com.bko.servicedesk.intent.SlotExtractor;
import com.bko.servicedesk.tools.CustomerRecord;
import com.bko.servicedesk.tools.TicketRecord;
import com.bko.servicedesk.tools.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SupportAgentTest {

    private final ToolRegistry toolRegistry = mock(ToolRegistry.class);
    private final SupportAgent agent = new SupportAgent(toolRegistry);
    private final IntentClassifier classifier = new IntentClassifier(new SlotExtractor());

    private RunContext context(String text, Long customerId) {
        CustomerQuery query = CustomerQuery.of(text, customerId);
        return new RunContext(query, classifier.classify(query));
    }

    private static CustomerRecord customer(long id, String name, CustomerStatus status) {
        OffsetDateTime now = OffsetDateTime.now();
        return new CustomerRecord(id, name, "x@example.com", null, status, now, now);
    }

    private static TicketRecord ticket(long id, long customerId, TicketPriority priority) {
        return new TicketRecord(id, customerId, "Alice", "issue", TicketStatus.OPEN, priority, OffsetDateTime.now());
    }

    @Test
    void testUrgencyLevels() {
        Intent escalation = classifier.classify("I was charged twice", CallerContext.empty());
        Intent help = classifier.classify("I need help with my account", CallerContext.empty());
        Intent plain = classifier.classify("Tell me about plans", CallerContext.empty());

        assertEquals(Urgency.HIGH, SupportAgent.assess(escalation, "I was charged twice", null).urgency());
        assertEquals(Urgency.MEDIUM, SupportAgent.assess(help, "I need help with my account", null).urgency());
        assertEquals(Urgency.LOW, SupportAgent.assess(plain, "Tell me about plans", null).urgency());
        assertEquals(Urgency.MEDIUM, SupportAgent.assess(plain, "Tell me about plans",
                customer(1L, "Alice", CustomerStatus.DISABLED)).urgency());
    }

    @Test
    void testUrgencyIsAssessedOncePerRun() {
        RunContext context = context("I need help upgrading my account", 1L);

        UrgencyAssessment first = agent.urgencyFor(context);
        UrgencyAssessment second = agent.urgencyFor(context);

        assertSame(first, second);
        assertEquals(first, context.urgency().orElseThrow());
    }

    @Test
    void testPersonalizedUpgradeReply() {
        RunContext context = context("I need help upgrading my account", 1L);
        context.resolveCustomer(customer(1L, "Alice", CustomerStatus.ACTIVE));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.PROVIDE_SUPPORT, TaskArguments.none()), context);

        assertTrue(result.success());
        assertTrue(result.text().startsWith("Hello Alice!"));
        assertTrue(result.text().contains("upgrade"));
        verifyNoInteractions(toolRegistry);
    }

    @Test
    void testGenericReplyWithoutCustomer() {
        RunContext context = context("Hmm, what now?", null);

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.PROVIDE_SUPPORT, TaskArguments.none()), context);

        assertTrue(result.text().startsWith("Hello!"));
        assertTrue(result.text().contains("more details"));
    }

    @Test
    void testHighUrgencyOverridesStatedPriority() {
        RunContext context = context("Urgent: open a low priority ticket, the site is down", 1L);
        when(toolRegistry.createTicket(eq(1L), anyString(), eq("high"))).thenReturn(ticket(20L, 1L, TicketPriority.HIGH));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.CREATE_TICKET,
                TaskArguments.builder().customerId(1L).priority("low").build()), context);

        assertTrue(result.success());
        assertTrue(result.text().contains(SupportAgent.ESCALATION_ACKNOWLEDGMENT));
        verify(toolRegistry).createTicket(eq(1L), anyString(), eq("high"));
    }

    @Test
    void testStatedPriorityUsedWithoutUrgency() {
        RunContext context = context("Please create a low priority ticket about my invoice layout", 1L);
        when(toolRegistry.createTicket(eq(1L), anyString(), eq("low"))).thenReturn(ticket(21L, 1L, TicketPriority.LOW));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.CREATE_TICKET, TaskArguments.forCustomer(1L)), context);

        assertTrue(result.success());
        assertFalse(result.text().contains(SupportAgent.ESCALATION_ACKNOWLEDGMENT));
    }

    @Test
    void testEscalationCreatesHighPriorityTicket() {
        RunContext context = context("I've been charged twice, please refund immediately!", 1L);
        context.resolveCustomer(customer(1L, "Alice", CustomerStatus.ACTIVE));
        when(toolRegistry.createTicket(1L, "I've been charged twice, please refund immediately!", "high"))
                .thenReturn(ticket(30L, 1L, TicketPriority.HIGH));

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.ESCALATE, TaskArguments.none()), context);

        assertTrue(result.success());
        assertEquals(TicketPriority.HIGH, result.payloadAs(EscalationPayload.class).ticket().priority());
        assertTrue(result.text().contains("ESCALATED TICKET"));
        assertTrue(result.text().contains(SupportAgent.ESCALATION_ACKNOWLEDGMENT));
    }

    @Test
    void testEscalationWithoutCustomerStillAcknowledges() {
        RunContext context = context("This is an emergency!", null);

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.ESCALATE, TaskArguments.none()), context);

        assertFalse(result.success());
        assertEquals(ErrorKind.VALIDATION_ERROR, result.error().kind());
        assertTrue(result.text().contains(SupportAgent.ESCALATION_ACKNOWLEDGMENT));
        verifyNoInteractions(toolRegistry);
    }

    @Test
    void testEscalationForUnknownCustomerReportsNotFound() {
        RunContext context = context("This is an emergency for customer 404!", null);

        TaskResult result = agent.handle(AgentTask.of(TaskOperation.ESCALATE, TaskArguments.none()), context);

        assertFalse(result.success());
        assertEquals(ErrorKind.NOT_FOUND, result.error().kind());
        assertTrue(result.error().message().contains("404"));
        assertNotEquals(SupportAgent.MISSING_CUSTOMER_MESSAGE, result.error().message());
        assertTrue(result.text().contains(SupportAgent.ESCALATION_ACKNOWLEDGMENT));
        verifyNoInteractions(toolRegistry);
    }

    @Test
    void testUrgencyPhrasesAreWordBounded() {
        Intent intent = classifier.classify("question about my download speed", CallerContext.empty());
        assertNotEquals(Urgency.HIGH, SupportAgent.assess(intent, "question about my download speed", null).urgency());
        Intent outage = classifier.classify("the site is down", CallerContext.empty());
        assertEquals(Urgency.HIGH, SupportAgent.assess(outage, "the site is down", null).urgency());
    }
}
