package com.bko.servicedesk.orchestration;

import com.bko.servicedesk.activity.ActivityLog;
import com.bko.servicedesk.agent.ErrorInfo;
import com.bko.servicedesk.agent.ErrorKind;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.intent.CustomerQuery;
import com.bko.servicedesk.intent.Intent;
import com.bko.servicedesk.intent.IntentClassifier;
import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationResponse;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;
import com.bko.servicedesk.orchestration.model.RunState;
import com.bko.servicedesk.orchestration.pattern.CoordinationPattern;
import com.bko.servicedesk.orchestration.pattern.PatternRegistry;
import com.bko.servicedesk.orchestration.service.RunAuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for customer queries. Drives each run through
 * RECEIVED, CLASSIFIED, DISPATCHING, AGGREGATING and finally COMPLETED or FAILED, and always returns a response.
 */
@Service
@Slf4j
public class OrchestratorService {

    static final String FAILURE_TEXT = "We're sorry, something went wrong while processing your request. "
            + "Our team has been notified; please try again shortly.";

    private final IntentClassifier intentClassifier;
    private final PatternRegistry patternRegistry;
    private final RunAuditService runAuditService;
    private final Clock clock;

    public OrchestratorService(IntentClassifier intentClassifier,
                               PatternRegistry patternRegistry,
                               RunAuditService runAuditService,
                               Clock clock) {
        this.intentClassifier = intentClassifier;
        this.patternRegistry = patternRegistry;
        this.runAuditService = runAuditService;
        this.clock = clock;
    }

    public OrchestrationResponse handle(CustomerQuery query) {
        String runId = UUID.randomUUID().toString();
        OrchestrationRun run = new OrchestrationRun(runId, query, new ActivityLog(runId, clock));
        run.activityLog().ok(OrchestrationRun.ACTOR, "received", query.text());
        log.info("Run {} received query", runId);

        OrchestrationResponse response;
        try {
            Intent intent = intentClassifier.classify(query);
            run.classified(intent);
            CoordinationPattern pattern = patternRegistry.patternFor(intent.kind());

            run.transitionTo(RunState.DISPATCHING, pattern.getClass().getSimpleName());
            PatternOutcome outcome = pattern.execute(run);

            run.transitionTo(RunState.AGGREGATING, outcome.results().size() + " results");
            response = aggregate(run, intent.kind(), outcome);
        } catch (RuntimeException ex) {
            log.error("Run {} failed", runId, ex);
            response = failed(run, ex);
        }
        runAuditService.record(query, response);
        log.info("Run {} finished in state {} (success={}, errors={})",
                runId, response.finalState(), response.success(), response.errors().size());
        return response;
    }

    private OrchestrationResponse aggregate(OrchestrationRun run, IntentKind kind, PatternOutcome outcome) {
        List<TaskResult> results = outcome.results();
        List<ErrorInfo> errors = results.stream()
                .filter(result -> !result.success())
                .map(TaskResult::error)
                .toList();
        long succeeded = results.stream().filter(TaskResult::success).count();

        ErrorKind failureKind = null;
        if (!errors.isEmpty()) {
            failureKind = outcome.independent() && succeeded > 0 ? ErrorKind.PARTIAL_FAILURE : errors.get(0).kind();
        }
        String text = composeText(results);
        run.transitionTo(RunState.COMPLETED, errors.isEmpty() ? "ok" : errors.size() + " errors");
        return new OrchestrationResponse(run.runId(), errors.isEmpty(), text, kind, run.activityLog().entries(),
                errors, outcome.escalated(), run.state(), failureKind, results);
    }

    private OrchestrationResponse failed(OrchestrationRun run, RuntimeException ex) {
        ErrorInfo error = new ErrorInfo(ErrorKind.UPSTREAM_FAILURE,
                ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), "orchestrator");
        if (!run.state().isTerminal()) {
            run.transitionTo(RunState.FAILED, error.message());
        }
        Intent intent = run.intentOrNull();
        List<TaskResult> results = intent == null ? List.of() : run.context().priorResults();
        return new OrchestrationResponse(run.runId(), false, FAILURE_TEXT, kindOf(intent), run.activityLog().entries(),
                List.of(error), false, run.state(), ErrorKind.UPSTREAM_FAILURE, results);
    }

    static String composeText(List<TaskResult> results) {
        StringBuilder text = new StringBuilder();
        for (TaskResult result : results) {
            if (!text.isEmpty()) {
                text.append("\n\n");
            }
            if (result.success()) {
                text.append(result.text());
                continue;
            }
            ErrorInfo error = result.error();
            if (!result.text().equals(error.message())) {
                text.append(result.text()).append("\n");
            }
            text.append(describeFailure(result, error));
        }
        return text.toString();
    }

    private static String describeFailure(TaskResult result, ErrorInfo error) {
        String prefix = switch (error.kind()) {
            case NOT_FOUND -> "Not found";
            case VALIDATION_ERROR -> "Invalid request";
            case UPSTREAM_FAILURE -> "Service unavailable";
            case PARTIAL_FAILURE -> "Partially completed";
        };
        return prefix + " (" + result.task().describe() + "): " + error.message();
    }

    @Nullable
    private static IntentKind kindOf(@Nullable Intent intent) {
        return intent == null ? null : intent.kind();
    }
}
