package com.bko.servicedesk.agent;

import static com.bko.servicedesk.intent.IntentKeywords.HIGH_URGENCY_PHRASES;
import static com.bko.servicedesk.intent.IntentKeywords.MEDIUM_URGENCY_PHRASES;

import com.bko.servicedesk.agent.TaskPayload.EscalationPayload;
import com.bko.servicedesk.agent.TaskPayload.SupportReplyPayload;
import com.bko.servicedesk.agent.TaskPayload.TicketPayload;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.intent.Intent;
import com.bko.servicedesk.tools.CustomerRecord;
import com.bko.servicedesk.tools.TicketRecord;
import com.bko.servicedesk.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Creates tickets and writes the customer-facing reply. Urgency is assessed once per run and kept in the
 * {@link RunContext}; high urgency always produces a high-priority ticket.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SupportAgent extends AbstractSpecialistAgent {

    public static final String ESCALATION_ACKNOWLEDGMENT =
            "Your request has been escalated to our priority support team.";
    static final String MISSING_CUSTOMER_MESSAGE =
            "A customer reference is required to open a priority ticket";

    private static final Map<String, Pattern> HIGH_URGENCY_PATTERNS = phrasePatterns(HIGH_URGENCY_PHRASES);
    private static final Map<String, Pattern> MEDIUM_URGENCY_PATTERNS = phrasePatterns(MEDIUM_URGENCY_PHRASES);

    private final ToolRegistry toolRegistry;

    @Override
    public AgentKind kind() {
        return AgentKind.SUPPORT;
    }

    @Override
    protected TaskResult execute(AgentTask task, RunContext context) {
        log.debug("Support agent executing {}", task.describe());
        return switch (task.operation()) {
            case PROVIDE_SUPPORT -> provideSupport(task, context);
            case CREATE_TICKET -> createTicket(task, context);
            case ESCALATE -> escalate(task, context);
            default -> unsupported(task, kind());
        };
    }

    /**
     * Returns the run's urgency, assessing and recording it on first use.
     */
    public UrgencyAssessment urgencyFor(RunContext context) {
        synchronized (context) {
            Optional<UrgencyAssessment> existing = context.urgency();
            if (existing.isPresent()) {
                return existing.get();
            }
            UrgencyAssessment assessment = assess(context.intent(), context.query().text(),
                    context.resolvedCustomer().orElse(null));
            context.assessUrgency(assessment);
            log.debug("Urgency assessed as {} ({})", assessment.urgency(), assessment.reason());
            return assessment;
        }
    }

    static UrgencyAssessment assess(Intent intent, @Nullable String queryText, @Nullable CustomerRecord customer) {
        if (intent.highUrgency()) {
            String reason = intent.urgencyKeyword() != null
                    ? "Urgency keyword '" + intent.urgencyKeyword() + "'"
                    : "Classified as escalation";
            return new UrgencyAssessment(Urgency.HIGH, reason);
        }
        String text = queryText == null ? "" : queryText.toLowerCase(Locale.ROOT);
        String high = firstPhrase(text, HIGH_URGENCY_PATTERNS);
        if (high != null) {
            return new UrgencyAssessment(Urgency.HIGH, "Urgency keyword '" + high + "'");
        }
        String medium = firstPhrase(text, MEDIUM_URGENCY_PATTERNS);
        if (medium != null) {
            return new UrgencyAssessment(Urgency.MEDIUM, "Support keyword '" + medium + "'");
        }
        if (customer != null && customer.status() == CustomerStatus.DISABLED) {
            return new UrgencyAssessment(Urgency.MEDIUM, "Account is disabled");
        }
        return new UrgencyAssessment(Urgency.LOW, "No urgency indicators");
    }

    private TaskResult provideSupport(AgentTask task, RunContext context) {
        UrgencyAssessment urgency = urgencyFor(context);
        CustomerRecord customer = context.resolvedCustomer().orElse(null);
        String query = StringUtils.hasText(task.arguments().query()) ? task.arguments().query() : context.query().text();
        StringBuilder text = new StringBuilder(reply(query, customer));
        if (urgency.isHigh()) {
            text.append("\n\nThis request has been marked as high priority.");
        }
        return TaskResult.ok(task, new SupportReplyPayload(customer, urgency), text.toString());
    }

    private TaskResult createTicket(AgentTask task, RunContext context) {
        TaskArguments args = task.arguments();
        Long customerId = args.customerId() != null
                ? args.customerId()
                : context.resolvedCustomer().map(CustomerRecord::id).orElse(null);
        UrgencyAssessment urgency = urgencyFor(context);
        String issue = StringUtils.hasText(args.issue()) ? args.issue() : context.query().text();
        String priority = urgency.isHigh() ? TicketPriority.HIGH.value() : statedPriority(args, context);

        TicketRecord ticket = toolRegistry.createTicket(customerId, issue, priority);
        StringBuilder text = new StringBuilder("Created ticket #").append(ticket.id())
                .append(" for ").append(ticket.customerName())
                .append(" (ID: ").append(ticket.customerId()).append(") with ")
                .append(ticket.priority().value()).append(" priority.");
        if (urgency.isHigh()) {
            text.append("\n").append(ESCALATION_ACKNOWLEDGMENT);
        }
        return TaskResult.ok(task, new TicketPayload(ticket, urgency), text.toString());
    }

    private TaskResult escalate(AgentTask task, RunContext context) {
        UrgencyAssessment urgency = urgencyFor(context);
        Optional<CustomerRecord> customer = context.resolvedCustomer();
        if (customer.isEmpty()) {
            Long reference = context.intent().slots().customerId();
            if (reference == null) {
                String text = "ESCALATED REQUEST - Priority Support\n\n" + ESCALATION_ACKNOWLEDGMENT
                        + "\nWe could not identify your account, so no ticket was opened yet."
                        + " Please reply with your customer ID so we can open a priority ticket right away.";
                return TaskResult.failure(task, ErrorKind.VALIDATION_ERROR, MISSING_CUSTOMER_MESSAGE, text);
            }
            String text = "ESCALATED REQUEST - Priority Support\n\n" + ESCALATION_ACKNOWLEDGMENT
                    + "\nWe could not find an account with customer ID " + reference + ", so no ticket was opened yet."
                    + " Please check the ID and reply so we can open a priority ticket right away.";
            return TaskResult.failure(task, ErrorKind.NOT_FOUND,
                    "Customer " + reference + " not found; no priority ticket was opened", text);
        }
        String issue = StringUtils.hasText(task.arguments().issue()) ? task.arguments().issue() : context.query().text();
        TicketRecord ticket = toolRegistry.createTicket(customer.get().id(), issue, TicketPriority.HIGH.value());
        log.info("Escalated ticket #{} created for customer {}", ticket.id(), ticket.customerId());
        String text = "ESCALATED TICKET - Priority Support\n\n"
                + "Hello " + customer.get().name() + ", we're sorry for the trouble. " + ESCALATION_ACKNOWLEDGMENT
                + "\nTicket #" + ticket.id() + " has been created with HIGH priority and flagged for immediate attention."
                + "\nExpected response time: Within 1 hour.";
        return TaskResult.ok(task, new EscalationPayload(ticket, urgency), text);
    }

    private static String statedPriority(TaskArguments args, RunContext context) {
        if (StringUtils.hasText(args.priority())) {
            return args.priority();
        }
        TicketPriority fromQuery = context.intent().slots().priority();
        return fromQuery != null ? fromQuery.value() : TicketPriority.MEDIUM.value();
    }

    static String reply(@Nullable String query, @Nullable CustomerRecord customer) {
        String text = query == null ? "" : query.toLowerCase(Locale.ROOT);
        String greeting = customer != null ? "Hello " + customer.name() + "! " : "Hello! ";
        if (text.contains("upgrad")) {
            return greeting + "I'd be happy to help you upgrade your account. "
                    + "Our team will walk you through the available plans and apply the upgrade for you.";
        }
        if (text.contains("cancel")) {
            return greeting + "I'm sorry to hear you want to cancel. "
                    + "Before we proceed, a specialist will reach out to confirm the cancellation and review any options.";
        }
        if (text.contains("refund") || text.contains("charge") || text.contains("billing")) {
            return greeting + "I understand your concern about the charge. "
                    + "I'm going to escalate this to our billing team immediately to review your account.";
        }
        if (text.contains("help") || text.contains("support")) {
            return greeting + "I'm here to help. Our support team has your request and will follow up shortly.";
        }
        return greeting + "Thank you for contacting us. Could you share more details, such as your customer ID "
                + "and what you need help with, so we can assist you?";
    }

    @Nullable
    private static String firstPhrase(String text, Map<String, Pattern> phrases) {
        return phrases.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }

    private static Map<String, Pattern> phrasePatterns(List<String> phrases) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String phrase : phrases) {
            patterns.put(phrase, Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b"));
        }
        return Collections.unmodifiableMap(patterns);
    }
}
