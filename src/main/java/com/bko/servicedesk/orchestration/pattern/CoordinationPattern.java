package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.intent.IntentKind;
import com.bko.servicedesk.orchestration.model.OrchestrationRun;
import com.bko.servicedesk.orchestration.model.PatternOutcome;

/**
 * A fixed strategy for coordinating specialist agents. Exactly one pattern exists per {@link IntentKind}.
 */
public interface CoordinationPattern {

    IntentKind handles();

    PatternOutcome execute(OrchestrationRun run);
}
