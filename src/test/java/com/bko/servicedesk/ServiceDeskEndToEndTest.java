package com.bko.servicedesk;

import com.bko.servicedesk.agent.ErrorKind;
import com.bko.servicedesk.agent.SupportAgent;
import com.bko.servicedesk.entity.Customer;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.QueryRunLog;
import com.bko.servicedesk.entity.Ticket;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.OrchestratorService;
import com.bko.servicedesk.orchestration.model.OrchestrationResponse;
import com.bko.servicedesk.orchestration.model.RunState;
import com.bko.servicedesk.repository.CustomerRepository;
import com.bko.servicedesk.repository.QueryRunLogRepository;
import com.bko.servicedesk.repository.TicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ServiceDeskEndToEndTest {

    @Autowired
    private OrchestratorService orchestratorService;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private TicketRepository ticketRepository;

    @Autowired
    private QueryRunLogRepository queryRunLogRepository;

    private Customer charlie;

    @BeforeEach
    void setUp() {
        queryRunLogRepository.deleteAll();
        ticketRepository.deleteAll();
        customerRepository.deleteAll();
        charlie = customerRepository.save(Customer.builder()
                .name("Charlie Brown")
                .email("charlie.brown@email.com")
                .phone("+1-555-0103")
                .status(CustomerStatus.ACTIVE)
                .build());
    }

    @Test
    void testSimpleLookup() {
        OrchestrationResponse response = orchestratorService.handle(
                CustomerQuery.of("Get customer information for ID " + charlie.getId()));

        assertTrue(response.success());
        assertEquals(IntentKind.SIMPLE_LOOKUP, response.patternUsed());
        assertEquals(RunState.COMPLETED, response.finalState());
        assertTrue(response.text().contains("Charlie Brown"));
        assertTrue(response.text().contains("active"));
        assertTrue(response.errors().isEmpty());
    }

    @Test
    void testBillingEscalationCreatesHighPriorityTicket() {
        OrchestrationResponse response = orchestratorService.handle(
                CustomerQuery.of("I've been charged twice, please refund immediately!", charlie.getId()));

        assertTrue(response.success());
        assertTrue(response.escalated());
        assertEquals(IntentKind.ESCALATION, response.patternUsed());
        assertTrue(response.text().contains(SupportAgent.ESCALATION_ACKNOWLEDGMENT));

        List<Ticket> tickets = ticketRepository.findHistory(charlie.getId());
        assertEquals(1, tickets.size());
        assertEquals(TicketPriority.HIGH, tickets.get(0).getPriority());
    }

    @Test
    void testMultiIntentReportsPartialFailure() {
        OrchestrationResponse response = orchestratorService.handle(CustomerQuery.of(
                "Update email to charlie.new@email.com for customer " + charlie.getId()
                        + " and show history for customer 999999"));

        assertFalse(response.success());
        assertEquals(IntentKind.MULTI_INTENT, response.patternUsed());
        assertEquals(ErrorKind.PARTIAL_FAILURE, response.failureKind());
        assertEquals(1, response.errors().size());
        assertEquals(ErrorKind.NOT_FOUND, response.errors().get(0).kind());
        assertEquals("charlie.new@email.com", customerRepository.findById(charlie.getId()).orElseThrow().getEmail());
    }

    @Test
    void testEveryRunIsAudited() {
        orchestratorService.handle(CustomerQuery.of("What's the weather like?"));

        List<QueryRunLog> rows = queryRunLogRepository.findAll();
        assertEquals(1, rows.size());
        assertEquals("UNKNOWN", rows.get(0).getPatternUsed());
        assertEquals("COMPLETED", rows.get(0).getFinalState());
    }
}
