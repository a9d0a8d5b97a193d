package com.bko.servicedesk.agent;

import com.bko.servicedesk.agent.TaskPayload.CustomerListPayload;
import com.bko.servicedesk.agent.TaskPayload.CustomerPayload;
import com.bko.servicedesk.agent.TaskPayload.OpenTicketPortfolioPayload;
import com.bko.servicedesk.agent.TaskPayload.PriorityTicketsPayload;
import com.bko.servicedesk.agent.TaskPayload.TicketHistoryPayload;
import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.tools.CustomerOpenTickets;
import com.bko.servicedesk.tools.CustomerRecord;
import com.bko.servicedesk.tools.TicketRecord;
import com.bko.servicedesk.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read and update access to customer data through the {@link ToolRegistry}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataAgent extends AbstractSpecialistAgent {

    private final ToolRegistry toolRegistry;
    private final ServiceDeskProperties properties;

    @Override
    public AgentKind kind() {
        return AgentKind.DATA;
    }

    @Override
    protected TaskResult execute(AgentTask task, RunContext context) {
        TaskArguments args = task.arguments();
        log.debug("Data agent executing {}", task.describe());
        if (needsCustomer(task.operation()) && args.customerId() == null) {
            return TaskResult.failure(task, ErrorKind.VALIDATION_ERROR,
                    "A customer ID is required for " + task.operation() + " but none was given");
        }
        return switch (task.operation()) {
            case GET_CUSTOMER -> getCustomer(task, args);
            case LIST_CUSTOMERS -> listCustomers(task, args);
            case UPDATE_CUSTOMER -> updateCustomer(task, args);
            case GET_CUSTOMER_HISTORY -> customerHistory(task, args);
            case GET_TICKETS_BY_PRIORITY -> ticketsByPriority(task, args);
            case ACTIVE_CUSTOMERS_WITH_OPEN_TICKETS -> customersWithOpenTickets(task, args);
            case PRIORITY_TICKETS_FOR_STATUS -> priorityTicketsForStatus(task, args);
            default -> unsupported(task, kind());
        };
    }

    private static boolean needsCustomer(TaskOperation operation) {
        return operation == TaskOperation.GET_CUSTOMER
                || operation == TaskOperation.UPDATE_CUSTOMER
                || operation == TaskOperation.GET_CUSTOMER_HISTORY;
    }

    private TaskResult getCustomer(AgentTask task, TaskArguments args) {
        CustomerRecord customer = toolRegistry.getCustomer(args.customerId());
        return TaskResult.ok(task, new CustomerPayload(customer), formatCustomer(customer));
    }

    private TaskResult listCustomers(AgentTask task, TaskArguments args) {
        List<CustomerRecord> customers = toolRegistry.listCustomers(args.status(), args.limit());
        StringBuilder text = new StringBuilder("Customers (").append(customers.size()).append("):");
        for (CustomerRecord customer : customers) {
            text.append("\n  • ").append(customer.name())
                    .append(" (ID: ").append(customer.id()).append(") - ")
                    .append(customer.status().value());
        }
        return TaskResult.ok(task, new CustomerListPayload(customers), text.toString());
    }

    private TaskResult updateCustomer(AgentTask task, TaskArguments args) {
        CustomerRecord updated = toolRegistry.updateCustomer(args.customerId(), args.update());
        StringBuilder text = new StringBuilder("Updated customer ")
                .append(updated.name()).append(" (ID: ").append(updated.id()).append(").");
        if (args.update() != null) {
            if (args.update().email() != null) {
                text.append("\n  Email is now: ").append(updated.email());
            }
            if (args.update().phone() != null) {
                text.append("\n  Phone is now: ").append(updated.phone());
            }
            if (args.update().name() != null) {
                text.append("\n  Name is now: ").append(updated.name());
            }
            if (args.update().status() != null) {
                text.append("\n  Status is now: ").append(updated.status().value());
            }
        }
        return TaskResult.ok(task, new CustomerPayload(updated), text.toString());
    }

    private TaskResult customerHistory(AgentTask task, TaskArguments args) {
        CustomerRecord customer = toolRegistry.getCustomer(args.customerId());
        List<TicketRecord> tickets = toolRegistry.getCustomerHistory(customer.id());
        StringBuilder text = new StringBuilder("Ticket history for ")
                .append(customer.name()).append(" (ID: ").append(customer.id()).append("): ")
                .append(tickets.size()).append(tickets.size() == 1 ? " ticket" : " tickets");
        tickets.stream()
                .limit(properties.getHistoryPreviewSize())
                .forEach(ticket -> text.append("\n  • Ticket #").append(ticket.id()).append(": ")
                        .append(ticket.issue()).append(" [").append(ticket.status().value())
                        .append(", ").append(ticket.priority().value()).append("]"));
        if (tickets.size() > properties.getHistoryPreviewSize()) {
            text.append("\n  ... and ").append(tickets.size() - properties.getHistoryPreviewSize()).append(" more");
        }
        return TaskResult.ok(task, new TicketHistoryPayload(customer, tickets), text.toString());
    }

    private TaskResult ticketsByPriority(AgentTask task, TaskArguments args) {
        String priority = priorityOrDefault(args.priority());
        List<TicketRecord> tickets = toolRegistry.getTicketsByPriority(priority, args.customerIds());
        return TaskResult.ok(task, new PriorityTicketsPayload(priority, tickets),
                formatPriorityTickets(priority, null, tickets));
    }

    private TaskResult customersWithOpenTickets(AgentTask task, TaskArguments args) {
        String status = statusOrDefault(args.status());
        Set<Long> inStatus = customerIdsWithStatus(status);
        List<CustomerOpenTickets> matching = toolRegistry.getCustomersWithOpenTickets().stream()
                .filter(entry -> inStatus.contains(entry.customer().id()))
                .toList();

        StringBuilder text = new StringBuilder(StringUtils.capitalize(status))
                .append(" Customers with Open Tickets:\nTotal: ").append(matching.size())
                .append(matching.size() == 1 ? " customer" : " customers");
        for (CustomerOpenTickets entry : matching) {
            CustomerRecord customer = entry.customer();
            text.append("\n\n• ").append(customer.name()).append(" (ID: ").append(customer.id()).append(")")
                    .append("\n  Email: ").append(customer.email())
                    .append("\n  Open Tickets: ").append(entry.openTicketCount());
        }
        return TaskResult.ok(task, new OpenTicketPortfolioPayload(matching), text.toString());
    }

    private TaskResult priorityTicketsForStatus(AgentTask task, TaskArguments args) {
        String status = statusOrDefault(args.status());
        String priority = priorityOrDefault(args.priority());
        List<Long> ids = List.copyOf(customerIdsWithStatus(status));
        List<TicketRecord> tickets = toolRegistry.getTicketsByPriority(priority, ids);
        return TaskResult.ok(task, new PriorityTicketsPayload(priority, tickets),
                formatPriorityTickets(priority, status, tickets));
    }

    private Set<Long> customerIdsWithStatus(String status) {
        return toolRegistry.listCustomers(status, properties.getMaxListLimit()).stream()
                .map(CustomerRecord::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String statusOrDefault(@Nullable String status) {
        return StringUtils.hasText(status) ? status : CustomerStatus.ACTIVE.value();
    }

    private static String priorityOrDefault(@Nullable String priority) {
        return StringUtils.hasText(priority) ? priority : TicketPriority.HIGH.value();
    }

    static String formatCustomer(CustomerRecord customer) {
        return "Customer Information:"
                + "\n  ID: " + customer.id()
                + "\n  Name: " + customer.name()
                + "\n  Email: " + valueOrNone(customer.email())
                + "\n  Phone: " + valueOrNone(customer.phone())
                + "\n  Status: " + customer.status().value();
    }

    private static String formatPriorityTickets(String priority, @Nullable String status, List<TicketRecord> tickets) {
        StringBuilder text = new StringBuilder(StringUtils.capitalize(priority)).append("-priority tickets");
        if (status != null) {
            text.append(" for ").append(status).append(" customers");
        }
        text.append(": ").append(tickets.size());
        for (TicketRecord ticket : tickets) {
            text.append("\n  • Ticket #").append(ticket.id())
                    .append(" (").append(ticket.customerName()).append(", ID: ").append(ticket.customerId()).append("): ")
                    .append(ticket.issue()).append(" [").append(ticket.status().value()).append("]");
        }
        return text.toString();
    }

    private static String valueOrNone(@Nullable String value) {
        return StringUtils.hasText(value) ? value : "(none)";
    }
}
