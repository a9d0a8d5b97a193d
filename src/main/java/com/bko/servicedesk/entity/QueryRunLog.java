package com.bko.servicedesk.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "query_run_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryRunLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "query_text", nullable = false, columnDefinition = "TEXT")
    private String queryText;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "pattern_used", length = 30, nullable = false)
    private String patternUsed;

    @Column(name = "final_state", length = 20, nullable = false)
    private String finalState;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "escalated", nullable = false)
    private boolean escalated;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    @Column(name = "response_text", columnDefinition = "TEXT")
    private String responseText;

    @Column(name = "trace_json", columnDefinition = "TEXT")
    private String traceJson;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
