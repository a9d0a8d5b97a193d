package com.bko.servicedesk.tools;

import com.bko.servicedesk.entity.Customer;
import com.bko.servicedesk.entity.CustomerStatus;

import java.time.OffsetDateTime;

public record CustomerRecord(
        Long id,
        String name,
        String email,
        String phone,
        CustomerStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static CustomerRecord from(Customer customer) {
        return new CustomerRecord(customer.getId(), customer.getName(), customer.getEmail(), customer.getPhone(),
                customer.getStatus(), customer.getCreatedAt(), customer.getUpdatedAt());
    }

    public boolean isActive() {
        return status == CustomerStatus.ACTIVE;
    }
}
