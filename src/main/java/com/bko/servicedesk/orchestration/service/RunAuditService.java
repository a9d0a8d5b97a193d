package com.bko.servicedesk.orchestration.service;

import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.entity.QueryRunLog;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.orchestration.model.OrchestrationResponse;
import com.bko.servicedesk.repository.QueryRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Stores one summary row per finished run. Audit failures never reach the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunAuditService {

    static final String UNCLASSIFIED = "UNCLASSIFIED";

    private final QueryRunLogRepository queryRunLogRepository;
    private final JsonProcessingService jsonProcessingService;
    private final ServiceDeskProperties properties;

    public Optional<QueryRunLog> record(CustomerQuery query, OrchestrationResponse response) {
        if (!properties.isAuditEnabled()) {
            return Optional.empty();
        }
        try {
            QueryRunLog entry = QueryRunLog.builder()
                    .queryText(query.text())
                    .sessionId(query.context().sessionId())
                    .patternUsed(response.patternUsed() == null ? UNCLASSIFIED : response.patternUsed().name())
                    .finalState(response.finalState().name())
                    .success(response.success())
                    .escalated(response.escalated())
                    .errorCount(response.errors().size())
                    .responseText(response.text())
                    .traceJson(jsonProcessingService.toJson(response.trace()))
                    .build();
            return Optional.of(queryRunLogRepository.save(entry));
        } catch (Exception ex) {
            log.warn("Failed to audit run {}: {}", response.runId(), ex.getMessage());
            return Optional.empty();
        }
    }
}
