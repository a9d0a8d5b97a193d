package com.bko.servicedesk.orchestration.service;

import com.bko.servicedesk.activity.ActivityLog;
import com.bko.servicedesk.agent.AgentKind;
import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.ErrorKind;
import com.bko.servicedesk.agent.RunContext;
import com.bko.servicedesk.agent.SpecialistAgent;
import com.bko.servicedesk.agent.TaskResult;
import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes tasks to their owning agent, one at a time, and records every call in the run's activity log.
 * <p>
 * With a deadline configured, each call runs on the agent executor inside its own transaction. A call that
 * misses the deadline is cancelled and its transaction rolled back, so nothing it wrote outlives the
 * failure reported for it.
 */
@Service
@Slf4j
public class AgentDispatcher {

    private final Map<AgentKind, SpecialistAgent> agents = new EnumMap<>(AgentKind.class);
    private final ExecutorService agentExecutor;
    private final ServiceDeskProperties properties;
    private final TransactionOperations transactionOperations;

    public AgentDispatcher(List<SpecialistAgent> agents,
                           @Qualifier("agentExecutor") ExecutorService agentExecutor,
                           ServiceDeskProperties properties,
                           TransactionOperations transactionOperations) {
        for (SpecialistAgent agent : agents) {
            SpecialistAgent previous = this.agents.put(agent.kind(), agent);
            if (previous != null) {
                throw new IllegalStateException("Two specialist agents registered for " + agent.kind());
            }
        }
        this.agentExecutor = agentExecutor;
        this.properties = properties;
        this.transactionOperations = transactionOperations;
    }

    public TaskResult dispatch(OrchestrationRun run, AgentTask task) {
        ActivityLog activityLog = run.activityLog();
        RunContext context = run.context();
        SpecialistAgent agent = agents.get(task.agent());
        activityLog.ok(OrchestrationRun.ACTOR, "dispatch", task.describe() + " -> " + task.agent().actor());

        TaskResult result;
        if (agent == null) {
            result = TaskResult.failure(task, ErrorKind.VALIDATION_ERROR,
                    "No specialist agent registered for " + task.agent());
        } else if (properties.hasAgentTimeout()) {
            result = withDeadline(agent, task, context);
        } else {
            result = agent.handle(task, context);
        }

        if (result.success()) {
            activityLog.ok(task.agent().actor(), task.operation().name(), summarize(result.text()));
        } else {
            activityLog.error(task.agent().actor(), task.operation().name(),
                    result.error().kind() + ": " + result.error().message());
        }
        context.addResult(result);
        return result;
    }

    /**
     * Records a task that was refused before reaching any agent as a {@code VALIDATION_ERROR} result.
     */
    public TaskResult reject(OrchestrationRun run, AgentTask task, String reason) {
        TaskResult result = TaskResult.failure(task, ErrorKind.VALIDATION_ERROR, reason);
        run.activityLog().error(OrchestrationRun.ACTOR, "reject", task.describe() + ": " + reason);
        run.context().addResult(result);
        return result;
    }

    private TaskResult withDeadline(SpecialistAgent agent, AgentTask task, RunContext context) {
        long timeoutMillis = properties.getAgentTimeout().toMillis();
        // set once, either by the worker about to commit or by the dispatcher giving up
        AtomicBoolean settled = new AtomicBoolean();
        Future<TaskResult> future = agentExecutor.submit(() -> transactionOperations.execute(status -> {
            TaskResult result = agent.handle(task, context);
            if (!settled.compareAndSet(false, true) || !result.success()) {
                status.setRollbackOnly();
            }
            return result;
        }));
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            if (!settled.compareAndSet(false, true)) {
                // the worker already finished and is committing
                return awaitSettled(future, task);
            }
            future.cancel(true);
            String message = task.agent().actor() + " did not answer within " + timeoutMillis + " ms";
            log.warn("Agent call {} abandoned: {}", task.describe(), message);
            return TaskResult.failure(task, ErrorKind.UPSTREAM_FAILURE, message);
        } catch (ExecutionException ex) {
            return executionFailure(task, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            settled.set(true);
            future.cancel(true);
            return TaskResult.failure(task, ErrorKind.UPSTREAM_FAILURE,
                    "Interrupted while waiting for " + task.agent().actor());
        }
    }

    private TaskResult awaitSettled(Future<TaskResult> future, AgentTask task) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            return executionFailure(task, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return TaskResult.failure(task, ErrorKind.UPSTREAM_FAILURE,
                    "Interrupted while waiting for " + task.agent().actor());
        }
    }

    private static TaskResult executionFailure(AgentTask task, ExecutionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        String message = task.agent().actor() + " failed: " + cause.getMessage();
        log.warn("Agent call {} failed: {}", task.describe(), message);
        return TaskResult.failure(task, ErrorKind.UPSTREAM_FAILURE, message);
    }

    private static String summarize(String text) {
        String normalized = text.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= 160) {
            return normalized;
        }
        return normalized.substring(0, 160) + "...";
    }
}
