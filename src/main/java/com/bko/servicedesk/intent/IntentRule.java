package com.bko.servicedesk.intent;

import java.util.function.Predicate;

/**
 * One row of the classification table. The predicate receives the lower-cased query text.
 */
public record IntentRule(String name, Predicate<String> predicate, IntentKind kind) {

    public boolean matches(String normalizedText) {
        return predicate.test(normalizedText);
    }
}
