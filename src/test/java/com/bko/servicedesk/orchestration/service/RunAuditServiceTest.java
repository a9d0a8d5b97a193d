package com.bko.servicedesk.orchestration.service;

import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.entity.QueryRunLog;
import com.bko.servicedesk.intent.CallerContext;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationResponse;
import com.bko.servicedesk.orchestration.model.RunState;
import com.bko.servicedesk.repository.QueryRunLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RunAuditServiceTest {

    private final QueryRunLogRepository repository = mock(QueryRunLogRepository.class);
    private final ServiceDeskProperties properties = new ServiceDeskProperties();
    private final RunAuditService service = new RunAuditService(repository,
            new JsonProcessingService(new ObjectMapper().findAndRegisterModules()), properties);

    private final CustomerQuery query = new CustomerQuery("Get customer 1", new CallerContext(1L, "session-7"));
    private final OrchestrationResponse response = new OrchestrationResponse("run-1", true, "Customer Information",
            IntentKind.SIMPLE_LOOKUP, List.of(), List.of(), false, RunState.COMPLETED, null, List.of());

    @Test
    void testRecordsSummaryRow() {
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        Optional<QueryRunLog> saved = service.record(query, response);

        ArgumentCaptor<QueryRunLog> captor = ArgumentCaptor.forClass(QueryRunLog.class);
        verify(repository).save(captor.capture());
        QueryRunLog row = captor.getValue();
        assertTrue(saved.isPresent());
        assertEquals("SIMPLE_LOOKUP", row.getPatternUsed());
        assertEquals("COMPLETED", row.getFinalState());
        assertEquals("session-7", row.getSessionId());
        assertEquals("[]", row.getTraceJson());
        assertTrue(row.isSuccess());
    }

    @Test
    void testStoreFailureIsNotPropagated() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertTrue(service.record(query, response).isEmpty());
    }

    @Test
    void testDisabledAuditWritesNothing() {
        properties.setAuditEnabled(false);

        assertTrue(service.record(query, response).isEmpty());
        verifyNoInteractions(repository);
    }
}
