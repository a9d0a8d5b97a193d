package com.bko.servicedesk.tools;

import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.repository.CustomerRepository;
import com.bko.servicedesk.repository.TicketRepository;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolRegistryFailureTest {

    private final CustomerRepository customerRepository = mock(CustomerRepository.class);
    private final TicketRepository ticketRepository = mock(TicketRepository.class);
    private final Validator validator = mock(Validator.class);
    private final ToolRegistry toolRegistry = new ToolRegistry(customerRepository, ticketRepository, validator,
            new ServiceDeskProperties(), Clock.systemUTC());

    @Test
    void testStoreFailureBecomesUpstreamException() {
        when(customerRepository.findById(1L)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        ToolUpstreamException ex = assertThrows(ToolUpstreamException.class, () -> toolRegistry.getCustomer(1L));

        assertEquals(ToolRegistry.GET_CUSTOMER, ex.getOperation());
        assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
    }

    @Test
    void testValidationHappensBeforeStoreAccess() {
        assertThrows(ToolValidationException.class, () -> toolRegistry.createTicket(1L, "", "high"));
        assertThrows(ToolValidationException.class, () -> toolRegistry.listCustomers("unknown", null));

        verifyNoInteractions(customerRepository, ticketRepository);
    }

    @Test
    void testFailedUpdateNeverSaves() {
        when(customerRepository.findById(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThrows(ToolUpstreamException.class,
                () -> toolRegistry.updateCustomer(1L, CustomerUpdate.email("a@example.com")));

        verify(customerRepository, never()).saveAndFlush(any());
    }
}
