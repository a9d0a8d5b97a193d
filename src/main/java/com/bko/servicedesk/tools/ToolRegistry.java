package com.bko.servicedesk.tools;

import com.bko.servicedesk.config.ServiceDeskProperties;
import com.bko.servicedesk.entity.Customer;
import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.Ticket;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.entity.TicketStatus;
import com.bko.servicedesk.repository.CustomerRepository;
import com.bko.servicedesk.repository.OpenTicketCount;
import com.bko.servicedesk.repository.TicketRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Validated operations over the customer/ticket store. Every call validates its arguments before
 * touching the store and runs in its own transaction, so a mutation is either fully applied or not at all.
 */
@Service
@Slf4j
@Transactional
public class ToolRegistry {

    public static final String GET_CUSTOMER = "get_customer";
    public static final String LIST_CUSTOMERS = "list_customers";
    public static final String UPDATE_CUSTOMER = "update_customer";
    public static final String CREATE_TICKET = "create_ticket";
    public static final String GET_CUSTOMER_HISTORY = "get_customer_history";
    public static final String GET_TICKETS_BY_PRIORITY = "get_tickets_by_priority";
    public static final String GET_CUSTOMERS_WITH_OPEN_TICKETS = "get_customers_with_open_tickets";

    private static final int MAX_ISSUE_LENGTH = 2000;

    private final CustomerRepository customerRepository;
    private final TicketRepository ticketRepository;
    private final Validator validator;
    private final ServiceDeskProperties properties;
    private final Clock clock;

    public ToolRegistry(CustomerRepository customerRepository,
                        TicketRepository ticketRepository,
                        Validator validator,
                        ServiceDeskProperties properties,
                        Clock clock) {
        this.customerRepository = customerRepository;
        this.ticketRepository = ticketRepository;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CustomerRecord getCustomer(Long customerId) {
        log.info("Tool call: {} customerId={}", GET_CUSTOMER, customerId);
        requireId(GET_CUSTOMER, customerId, "customer_id");
        return store(GET_CUSTOMER, () -> CustomerRecord.from(findCustomer(GET_CUSTOMER, customerId)));
    }

    @Transactional(readOnly = true)
    public List<CustomerRecord> listCustomers(@Nullable String status, @Nullable Integer limit) {
        log.info("Tool call: {} status={}, limit={}", LIST_CUSTOMERS, status, limit);
        CustomerStatus filter = null;
        if (StringUtils.hasText(status)) {
            filter = CustomerStatus.parse(status).orElseThrow(() -> new ToolValidationException(LIST_CUSTOMERS,
                    "Invalid status filter '" + status + "'; expected active or disabled"));
        }
        int effectiveLimit = limit != null ? limit : properties.getDefaultListLimit();
        if (effectiveLimit < 1 || effectiveLimit > properties.getMaxListLimit()) {
            throw new ToolValidationException(LIST_CUSTOMERS,
                    "limit must be between 1 and " + properties.getMaxListLimit() + " but was " + effectiveLimit);
        }
        PageRequest page = PageRequest.of(0, effectiveLimit);
        CustomerStatus statusFilter = filter;
        List<Customer> customers = store(LIST_CUSTOMERS, () -> statusFilter == null
                ? customerRepository.findAllByOrderByIdAsc(page)
                : customerRepository.findByStatusOrderByIdAsc(statusFilter, page));
        return customers.stream().map(CustomerRecord::from).toList();
    }

    public CustomerRecord updateCustomer(Long customerId, @Nullable CustomerUpdate update) {
        log.info("Tool call: {} customerId={}, update={}", UPDATE_CUSTOMER, customerId, update);
        requireId(UPDATE_CUSTOMER, customerId, "customer_id");
        if (update == null || update.isEmpty()) {
            throw new ToolValidationException(UPDATE_CUSTOMER, "No valid fields to update");
        }
        validate(UPDATE_CUSTOMER, update);
        CustomerStatus newStatus = null;
        if (update.status() != null) {
            newStatus = CustomerStatus.parse(update.status()).orElseThrow(() -> new ToolValidationException(
                    UPDATE_CUSTOMER, "Invalid status '" + update.status() + "'; expected active or disabled"));
        }
        CustomerStatus statusToApply = newStatus;
        return store(UPDATE_CUSTOMER, () -> {
            Customer customer = findCustomer(UPDATE_CUSTOMER, customerId);
            if (update.name() != null) {
                customer.setName(update.name().trim());
            }
            if (update.email() != null) {
                customer.setEmail(update.email().trim());
            }
            if (update.phone() != null) {
                customer.setPhone(update.phone().trim());
            }
            if (statusToApply != null) {
                customer.setStatus(statusToApply);
            }
            customer.setUpdatedAt(nextUpdateTimestamp(customer.getUpdatedAt()));
            Customer saved = customerRepository.saveAndFlush(customer);
            log.info("Customer {} updated.", customerId);
            return CustomerRecord.from(saved);
        });
    }

    public TicketRecord createTicket(Long customerId, @Nullable String issue, @Nullable String priority) {
        log.info("Tool call: {} customerId={}, priority={}", CREATE_TICKET, customerId, priority);
        requireId(CREATE_TICKET, customerId, "customer_id");
        if (!StringUtils.hasText(issue)) {
            throw new ToolValidationException(CREATE_TICKET, "issue must not be blank");
        }
        if (issue.length() > MAX_ISSUE_LENGTH) {
            throw new ToolValidationException(CREATE_TICKET, "issue must be at most " + MAX_ISSUE_LENGTH + " characters");
        }
        TicketPriority ticketPriority = priority == null
                ? TicketPriority.MEDIUM
                : parsePriority(CREATE_TICKET, priority);
        return store(CREATE_TICKET, () -> {
            Customer customer = findCustomer(CREATE_TICKET, customerId);
            Ticket ticket = Ticket.builder()
                    .customer(customer)
                    .issue(issue.trim())
                    .status(TicketStatus.OPEN)
                    .priority(ticketPriority)
                    .build();
            Ticket saved = ticketRepository.saveAndFlush(ticket);
            log.info("Ticket #{} created for customer {} with priority {}.", saved.getId(), customerId, ticketPriority.value());
            return TicketRecord.from(saved);
        });
    }

    @Transactional(readOnly = true)
    public List<TicketRecord> getCustomerHistory(Long customerId) {
        log.info("Tool call: {} customerId={}", GET_CUSTOMER_HISTORY, customerId);
        requireId(GET_CUSTOMER_HISTORY, customerId, "customer_id");
        return store(GET_CUSTOMER_HISTORY, () -> {
            findCustomer(GET_CUSTOMER_HISTORY, customerId);
            return ticketRepository.findHistory(customerId).stream().map(TicketRecord::from).toList();
        });
    }

    @Transactional(readOnly = true)
    public List<TicketRecord> getTicketsByPriority(@Nullable String priority, @Nullable List<Long> customerIds) {
        log.info("Tool call: {} priority={}, customerIds={}", GET_TICKETS_BY_PRIORITY, priority, customerIds);
        if (!StringUtils.hasText(priority)) {
            throw new ToolValidationException(GET_TICKETS_BY_PRIORITY, "priority is required");
        }
        TicketPriority ticketPriority = parsePriority(GET_TICKETS_BY_PRIORITY, priority);
        if (customerIds == null) {
            return store(GET_TICKETS_BY_PRIORITY, () -> ticketRepository.findByPriority(ticketPriority)
                    .stream().map(TicketRecord::from).toList());
        }
        for (Long id : customerIds) {
            requireId(GET_TICKETS_BY_PRIORITY, id, "customer_ids");
        }
        if (customerIds.isEmpty()) {
            return List.of();
        }
        Set<Long> ids = Set.copyOf(customerIds);
        return store(GET_TICKETS_BY_PRIORITY, () -> ticketRepository.findByPriorityForCustomers(ticketPriority, ids)
                .stream().map(TicketRecord::from).toList());
    }

    @Transactional(readOnly = true)
    public List<CustomerOpenTickets> getCustomersWithOpenTickets() {
        log.info("Tool call: {}", GET_CUSTOMERS_WITH_OPEN_TICKETS);
        return store(GET_CUSTOMERS_WITH_OPEN_TICKETS, () -> {
            List<OpenTicketCount> counts = ticketRepository.countByStatusPerCustomer(TicketStatus.OPEN);
            if (counts.isEmpty()) {
                return List.<CustomerOpenTickets>of();
            }
            Map<Long, Customer> customers = customerRepository
                    .findByIdInOrderByIdAsc(counts.stream().map(OpenTicketCount::getCustomerId).toList())
                    .stream()
                    .collect(Collectors.toMap(Customer::getId, Function.identity()));
            return counts.stream()
                    .filter(count -> customers.containsKey(count.getCustomerId()))
                    .map(count -> new CustomerOpenTickets(CustomerRecord.from(customers.get(count.getCustomerId())),
                            count.getOpenCount()))
                    .sorted(Comparator.comparingLong(CustomerOpenTickets::openTicketCount).reversed()
                            .thenComparing(entry -> entry.customer().id()))
                    .toList();
        });
    }

    private Customer findCustomer(String operation, Long customerId) {
        return customerRepository.findById(customerId)
                .orElseThrow(() -> ToolNotFoundException.customer(operation, customerId));
    }

    private void requireId(String operation, @Nullable Long id, String argument) {
        if (id == null || id <= 0) {
            throw new ToolValidationException(operation, argument + " must be a positive integer but was " + id);
        }
    }

    private TicketPriority parsePriority(String operation, String priority) {
        return TicketPriority.parse(priority).orElseThrow(() -> new ToolValidationException(operation,
                "Invalid priority '" + priority + "'; expected low, medium or high"));
    }

    private void validate(String operation, CustomerUpdate update) {
        Set<ConstraintViolation<CustomerUpdate>> violations = validator.validate(update);
        if (violations.isEmpty()) {
            return;
        }
        String message = violations.stream()
                .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        throw new ToolValidationException(operation, message);
    }

    // updatedAt must strictly advance, also when the clock has not moved since the previous write
    private OffsetDateTime nextUpdateTimestamp(@Nullable OffsetDateTime previous) {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        if (previous == null || now.isAfter(previous)) {
            return now;
        }
        return previous.truncatedTo(ChronoUnit.MICROS).plus(1, ChronoUnit.MICROS);
    }

    private <T> T store(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException ex) {
            log.warn("Tool {} failed in the backing store: {}", operation, ex.getMessage());
            throw new ToolUpstreamException(operation, "Backing store failure during " + operation, ex);
        }
    }
}
