package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.intent.IntentKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table from intent kind to pattern. Refuses to start unless every kind has exactly one pattern.
 */
@Component
@Slf4j
public class PatternRegistry {

    private final Map<IntentKind, CoordinationPattern> patterns = new EnumMap<>(IntentKind.class);

    public PatternRegistry(List<CoordinationPattern> patterns) {
        for (CoordinationPattern pattern : patterns) {
            CoordinationPattern previous = this.patterns.put(pattern.handles(), pattern);
            if (previous != null) {
                throw new IllegalStateException("Duplicate coordination patterns for " + pattern.handles() + ": "
                        + previous.getClass().getSimpleName() + ", " + pattern.getClass().getSimpleName());
            }
        }
        List<IntentKind> missing = Arrays.stream(IntentKind.values())
                .filter(kind -> !this.patterns.containsKey(kind))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No coordination pattern registered for " + missing);
        }
        log.info("Registered {} coordination patterns", this.patterns.size());
    }

    public CoordinationPattern patternFor(IntentKind kind) {
        CoordinationPattern pattern = patterns.get(kind);
        if (pattern == null) {
            throw new IllegalArgumentException("Unsupported intent kind: " + kind);
        }
        return pattern;
    }
}
