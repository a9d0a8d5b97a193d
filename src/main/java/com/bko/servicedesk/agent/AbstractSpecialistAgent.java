package com.bko.servicedesk.agent;

import com.bko.servicedesk.tools.ToolNotFoundException;
import com.bko.servicedesk.tools.ToolUpstreamException;
import com.bko.servicedesk.tools.ToolValidationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps tool registry failures onto {@link ErrorKind}s so that subclasses only deal with the happy path.
 */
@Slf4j
public abstract class AbstractSpecialistAgent implements SpecialistAgent {

    @Override
    public final TaskResult handle(AgentTask task, RunContext context) {
        if (task.agent() != kind()) {
            return TaskResult.failure(task, ErrorKind.VALIDATION_ERROR,
                    "Operation " + task.operation() + " is not supported by " + kind().actor());
        }
        try {
            return execute(task, context);
        } catch (ToolNotFoundException ex) {
            return TaskResult.failure(task, ErrorKind.NOT_FOUND, ex.getMessage());
        } catch (ToolValidationException ex) {
            return TaskResult.failure(task, ErrorKind.VALIDATION_ERROR, ex.getMessage());
        } catch (ToolUpstreamException ex) {
            return TaskResult.failure(task, ErrorKind.UPSTREAM_FAILURE, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("{} failed unexpectedly on {}", kind().actor(), task.describe(), ex);
            return TaskResult.failure(task, ErrorKind.UPSTREAM_FAILURE,
                    "Unexpected failure in " + kind().actor() + ": " + ex.getMessage());
        }
    }

    protected abstract TaskResult execute(AgentTask task, RunContext context);

    protected static TaskResult unsupported(AgentTask task, AgentKind kind) {
        return TaskResult.failure(task, ErrorKind.VALIDATION_ERROR,
                "Operation " + task.operation() + " is not supported by " + kind.actor());
    }
}
