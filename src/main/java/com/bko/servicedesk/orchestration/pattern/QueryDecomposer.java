package com.bko.servicedesk.orchestration.pattern;

import com.bko.servicedesk.agent.AgentTask;
import com.bko.servicedesk.agent.TaskArguments;
import com.bko.servicedesk.agent.TaskOperation;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.orchestration.pattern.Decomposition.RejectedClause;
import com.bko.servicedesk.intent.IntentKeywords;
import com.bko.servicedesk.intent.IntentSlots;
import com.bko.servicedesk.intent.SlotExtractor;
import com.bko.servicedesk.tools.CustomerUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a multi-intent query into independent sub-tasks. Each clause resolves its own customer reference
 * and falls back to the run's. Mutations are ordered before reads; otherwise clause order is kept.
 * A clause that asks for an action none of the sub-tasks covers is rejected rather than dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryDecomposer {

    private static final Pattern CLAUSE_SEPARATOR = Pattern.compile("\\s*(?:;|,|\\band\\b|\\bthen\\b|\\balso\\b)\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TICKET_CREATION = Pattern.compile("\\b(create|open|file|raise|new)\\b.*\\bticket\\b");
    private static final Pattern HISTORY = Pattern.compile("\\b(history|tickets)\\b");
    private static final Pattern PROFILE = Pattern.compile("\\b(show|get|profile|details|information|info)\\b");
    private static final Pattern NAME_UPDATE = Pattern.compile("\\bname\\s*(?:(?:to|is|as)\\b|:|=)\\s*(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_REFERENCE = Pattern.compile("\\s+for\\s+(?:customer|id|#).*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_UPDATE = Pattern.compile("\\bstatus\\b.*?\\b(active|disabled|inactive)\\b");
    private static final Pattern UPDATE_VERB = Pattern.compile("\\b(update|change|set)\\b");
    private static final List<Pattern> ACTION_VERB_PATTERNS = IntentKeywords.ACTION_VERBS.stream()
            .map(verb -> Pattern.compile("\\b" + Pattern.quote(verb) + "\\b"))
            .toList();

    private final SlotExtractor slotExtractor;

    public List<AgentTask> decompose(String queryText, IntentSlots runSlots) {
        return plan(queryText, runSlots).tasks();
    }

    public Decomposition plan(String queryText, IntentSlots runSlots) {
        List<AgentTask> mutations = new ArrayList<>();
        List<AgentTask> reads = new ArrayList<>();
        List<RejectedClause> rejected = new ArrayList<>();
        for (String clause : clauses(queryText)) {
            Optional<AgentTask> task = toTask(clause, runSlots.customerId());
            if (task.isEmpty()) {
                if (asksForAction(clause)) {
                    rejected.add(reject(clause, runSlots.customerId()));
                } else {
                    log.debug("No sub-task recognized in clause '{}'", clause);
                }
                continue;
            }
            if (task.get().operation().isMutation()) {
                mutations.add(task.get());
            } else {
                reads.add(task.get());
            }
        }
        List<AgentTask> ordered = new ArrayList<>(mutations);
        ordered.addAll(reads);
        return new Decomposition(ordered, rejected);
    }

    List<String> clauses(String queryText) {
        if (!StringUtils.hasText(queryText)) {
            return List.of();
        }
        return Arrays.stream(CLAUSE_SEPARATOR.split(queryText.trim()))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList();
    }

    private Optional<AgentTask> toTask(String clause, @Nullable Long runCustomerId) {
        String text = clause.toLowerCase(Locale.ROOT);
        Long clauseCustomer = slotExtractor.customerReference(clause);
        Long customerId = clauseCustomer != null ? clauseCustomer : runCustomerId;

        String email = slotExtractor.email(clause);
        if (text.contains("email") && email != null) {
            return Optional.of(update(customerId, CustomerUpdate.email(email)));
        }
        String phone = slotExtractor.phone(clause);
        if (text.contains("phone") && phone != null) {
            return Optional.of(update(customerId, CustomerUpdate.phone(phone)));
        }
        String name = UPDATE_VERB.matcher(text).find() ? newName(clause) : null;
        if (name != null) {
            return Optional.of(update(customerId, CustomerUpdate.name(name)));
        }
        Matcher status = STATUS_UPDATE.matcher(text);
        if (UPDATE_VERB.matcher(text).find() && status.find()) {
            String value = "inactive".equals(status.group(1)) ? CustomerStatus.DISABLED.value() : status.group(1);
            return Optional.of(update(customerId, CustomerUpdate.status(value)));
        }
        if (TICKET_CREATION.matcher(text).find()) {
            return Optional.of(AgentTask.of(TaskOperation.CREATE_TICKET, TaskArguments.builder()
                    .customerId(customerId)
                    .issue(clause)
                    .build()));
        }
        if (HISTORY.matcher(text).find()) {
            return Optional.of(AgentTask.of(TaskOperation.GET_CUSTOMER_HISTORY, TaskArguments.forCustomer(customerId)));
        }
        if (PROFILE.matcher(text).find()) {
            return Optional.of(AgentTask.of(TaskOperation.GET_CUSTOMER, TaskArguments.forCustomer(customerId)));
        }
        return Optional.empty();
    }

    @Nullable
    private static String newName(String clause) {
        Matcher matcher = NAME_UPDATE.matcher(clause);
        if (!matcher.find()) {
            return null;
        }
        String name = TRAILING_REFERENCE.matcher(matcher.group(1)).replaceFirst("")
                .replaceAll("[.!?]+$", "")
                .trim();
        return StringUtils.hasText(name) ? name : null;
    }

    private static boolean asksForAction(String clause) {
        String text = clause.toLowerCase(Locale.ROOT);
        return ACTION_VERB_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private RejectedClause reject(String clause, @Nullable Long runCustomerId) {
        String text = clause.toLowerCase(Locale.ROOT);
        Long clauseCustomer = slotExtractor.customerReference(clause);
        TaskOperation operation;
        if (UPDATE_VERB.matcher(text).find()) {
            operation = TaskOperation.UPDATE_CUSTOMER;
        } else if (text.contains("create")) {
            operation = TaskOperation.CREATE_TICKET;
        } else {
            operation = TaskOperation.GET_CUSTOMER;
        }
        AgentTask task = AgentTask.of(operation, TaskArguments.builder()
                .customerId(clauseCustomer != null ? clauseCustomer : runCustomerId)
                .query(clause)
                .build());
        return new RejectedClause(task, "Cannot handle '" + clause + "': supported requests are email, phone, name"
                + " and status updates, ticket creation, ticket history and profile lookups");
    }

    private static AgentTask update(@Nullable Long customerId, CustomerUpdate update) {
        return AgentTask.of(TaskOperation.UPDATE_CUSTOMER, TaskArguments.builder()
                .customerId(customerId)
                .update(update)
                .build());
    }
}
