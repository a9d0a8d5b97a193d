package com.bko.servicedesk.repository;

import com.bko.servicedesk.entity.QueryRunLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link QueryRunLog} entities.
 */
public interface QueryRunLogRepository extends JpaRepository<QueryRunLog, UUID> {

    List<QueryRunLog> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
