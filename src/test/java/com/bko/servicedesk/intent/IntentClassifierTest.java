package com.bko.servicedesk.intent;

import com.bko.servicedesk.entity.TicketPriority;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier(new SlotExtractor());

    @Test
    void testSimpleLookupWithIdentifier() {
        Intent intent = classifier.classify("Get customer information for ID 5", CallerContext.empty());
        assertEquals(IntentKind.SIMPLE_LOOKUP, intent.kind());
        assertEquals(IntentKeywords.RULE_CUSTOMER_LOOKUP, intent.matchedRule());
        assertEquals(5L, intent.slots().customerId());
        assertNull(intent.urgencyKeyword());
    }

    @Test
    void testSimpleLookupWithLongIdentifier() {
        Intent intent = classifier.classify("Get customer information for ID 12345678", null);
        assertEquals(IntentKind.SIMPLE_LOOKUP, intent.kind());
        assertEquals(12345678L, intent.slots().customerId());
        assertEquals(List.of(12345678L), intent.slots().identifiers());
    }

    @Test
    void testUrgencyBeatsLookup() {
        Intent intent = classifier.classify("Get customer information for ID 5, I was charged twice!", CallerContext.empty());
        assertEquals(IntentKind.ESCALATION, intent.kind());
        assertEquals("charged twice", intent.urgencyKeyword());
        assertEquals(5L, intent.slots().customerId());
        assertTrue(intent.highUrgency());
    }

    @Test
    void testLookupWithSupportWordIsNegotiation() {
        Intent intent = classifier.classify("Show customer 3, they need help with an upgrade", CallerContext.empty());
        assertEquals(IntentKind.NEGOTIATION, intent.kind());
        assertTrue(intent.requiresCustomerContext());
    }

    @Test
    void testMultipleActionsIsMultiIntent() {
        Intent intent = classifier.classify("Update my email to new@example.com and show my ticket history",
                CallerContext.forCustomer(2L));
        assertEquals(IntentKind.MULTI_INTENT, intent.kind());
        assertEquals("new@example.com", intent.slots().email());
        assertEquals(2L, intent.slots().customerId());
    }

    @Test
    void testActionVerbsAreWordBounded() {
        Intent intent = classifier.classify("Updated records showed nothing unusual", CallerContext.empty());
        assertEquals(IntentKind.UNKNOWN, intent.kind());
    }

    @Test
    void testPortfolioQueryIsMultiStep() {
        Intent intent = classifier.classify("Show me all active customers who have open tickets", CallerContext.empty());
        assertEquals(IntentKind.MULTI_STEP, intent.kind());
        assertEquals(IntentKeywords.RULE_PORTFOLIO_ANALYSIS, intent.matchedRule());
    }

    @Test
    void testHighPriorityTicketsCarryPrioritySlot() {
        Intent intent = classifier.classify("What's the status of all high-priority tickets for premium customers?",
                CallerContext.empty());
        assertEquals(IntentKind.MULTI_STEP, intent.kind());
        assertEquals(TicketPriority.HIGH, intent.slots().priority());
    }

    @Test
    void testSupportRequest() {
        Intent intent = classifier.classify("I need help upgrading my account", CallerContext.forCustomer(7L));
        assertEquals(IntentKind.NEGOTIATION, intent.kind());
        assertEquals(7L, intent.slots().customerId());
    }

    @Test
    void testNoRuleMatchesIsUnknown() {
        Intent intent = classifier.classify("What's the weather like today?", CallerContext.empty());
        assertEquals(IntentKind.UNKNOWN, intent.kind());
        assertEquals(Intent.NO_RULE, intent.matchedRule());
        assertFalse(intent.highUrgency());
    }

    @Test
    void testEmptyQueryIsUnknown() {
        assertEquals(IntentKind.UNKNOWN, classifier.classify("", null).kind());
        assertEquals(IntentKind.UNKNOWN, classifier.classify(null, null).kind());
    }

    @Test
    void testCaseInsensitive() {
        Intent lower = classifier.classify("get customer information for id 12", CallerContext.empty());
        Intent upper = classifier.classify("GET CUSTOMER INFORMATION FOR ID 12", CallerContext.empty());
        assertEquals(lower, upper);
    }

    @Test
    void testClassificationIsDeterministic() {
        String query = "I've been charged twice, please refund immediately!";
        Intent first = classifier.classify(query, CallerContext.forCustomer(1L));
        for (int i = 0; i < 20; i++) {
            assertEquals(first, classifier.classify(query, CallerContext.forCustomer(1L)));
        }
    }

    @Test
    void testRuleTableOrder() {
        List<String> names = classifier.rules().stream().map(IntentRule::name).toList();
        assertEquals(List.of(
                IntentKeywords.RULE_URGENT_BILLING,
                IntentKeywords.RULE_CUSTOMER_LOOKUP,
                IntentKeywords.RULE_MULTIPLE_ACTIONS,
                IntentKeywords.RULE_PORTFOLIO_ANALYSIS,
                IntentKeywords.RULE_ASSISTED_SUPPORT), names);
    }
}
