package com.bko.servicedesk.repository;

import com.bko.servicedesk.entity.Customer;
import com.bko.servicedesk.entity.CustomerStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CustomerRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private CustomerRepository customerRepository;

    @Test
    void testSaveAndFind() {
        Customer saved = customerRepository.save(Customer.builder()
                .name("Alice Johnson")
                .email("alice@example.com")
                .phone("+1-555-0100")
                .build());
        assertNotNull(saved.getId());
        assertNotNull(saved.getUpdatedAt());

        Optional<Customer> found = customerRepository.findById(saved.getId());
        assertTrue(found.isPresent());
        assertEquals("Alice Johnson", found.get().getName());
        assertEquals(CustomerStatus.ACTIVE, found.get().getStatus());
    }

    @Test
    void testFindByStatusOrdersById() {
        customerRepository.save(Customer.builder().name("A").status(CustomerStatus.ACTIVE).build());
        customerRepository.save(Customer.builder().name("B").status(CustomerStatus.DISABLED).build());
        customerRepository.save(Customer.builder().name("C").status(CustomerStatus.ACTIVE).build());

        List<Customer> active = customerRepository.findByStatusOrderByIdAsc(CustomerStatus.ACTIVE, PageRequest.of(0, 10));

        assertEquals(List.of("A", "C"), active.stream().map(Customer::getName).toList());
    }
}
