package com.bko.servicedesk.intent;

import static com.bko.servicedesk.intent.IntentKeywords.*;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic rule-table classifier. The first matching rule wins; rules are evaluated in declaration order.
 */
@Service
@Slf4j
public class IntentClassifier {

    private static final List<Pattern> ACTION_VERB_PATTERNS = ACTION_VERBS.stream()
            .map(verb -> Pattern.compile("\\b" + Pattern.quote(verb) + "\\b"))
            .toList();

    private final SlotExtractor slotExtractor;
    private final List<IntentRule> rules;

    public IntentClassifier(SlotExtractor slotExtractor) {
        this.slotExtractor = slotExtractor;
        this.rules = List.of(
                new IntentRule(RULE_URGENT_BILLING, text -> containsAny(text, ESCALATION_PHRASES), IntentKind.ESCALATION),
                new IntentRule(RULE_CUSTOMER_LOOKUP,
                        text -> containsAny(text, LOOKUP_PHRASES) && !containsAny(text, SUPPORT_WORDS),
                        IntentKind.SIMPLE_LOOKUP),
                new IntentRule(RULE_MULTIPLE_ACTIONS, text -> distinctActions(text) >= MIN_DISTINCT_ACTIONS,
                        IntentKind.MULTI_INTENT),
                new IntentRule(RULE_PORTFOLIO_ANALYSIS, text -> containsAny(text, PORTFOLIO_PHRASES), IntentKind.MULTI_STEP),
                new IntentRule(RULE_ASSISTED_SUPPORT, text -> containsAny(text, ASSISTED_SUPPORT_PHRASES),
                        IntentKind.NEGOTIATION)
        );
    }

    public Intent classify(CustomerQuery query) {
        return classify(query.text(), query.context());
    }

    public Intent classify(@Nullable String text, @Nullable CallerContext context) {
        CallerContext callerContext = context == null ? CallerContext.empty() : context;
        String raw = text == null ? "" : text;
        IntentSlots slots = slotExtractor.extract(raw, callerContext);
        String normalized = normalize(raw);
        String urgencyKeyword = urgencyKeyword(normalized);

        for (IntentRule rule : rules) {
            if (rule.matches(normalized)) {
                log.debug("Query matched rule '{}' -> {}", rule.name(), rule.kind());
                return new Intent(rule.kind(), slots, rule.name(), urgencyKeyword);
            }
        }
        log.debug("No classification rule matched; falling back to {}", IntentKind.UNKNOWN);
        return new Intent(IntentKind.UNKNOWN, slots, Intent.NO_RULE, urgencyKeyword);
    }

    public List<IntentRule> rules() {
        return rules;
    }

    static String normalize(String text) {
        if (!StringUtils.hasText(text)) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    @Nullable
    private static String urgencyKeyword(String normalized) {
        return ESCALATION_PHRASES.stream()
                .filter(normalized::contains)
                .findFirst()
                .orElse(null);
    }

    private static boolean containsAny(String text, List<String> phrases) {
        return phrases.stream().anyMatch(text::contains);
    }

    private static long distinctActions(String text) {
        return ACTION_VERB_PATTERNS.stream()
                .filter(pattern -> pattern.matcher(text).find())
                .count();
    }
}
