package com.bko.servicedesk.repository;

import com.bko.servicedesk.entity.Customer;
import com.bko.servicedesk.entity.CustomerStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for managing {@link Customer} entities.
 */
public interface CustomerRepository extends JpaRepository<Customer, Long> {

    List<Customer> findByStatusOrderByIdAsc(CustomerStatus status, Pageable pageable);

    List<Customer> findAllByOrderByIdAsc(Pageable pageable);

    List<Customer> findByIdInOrderByIdAsc(Collection<Long> ids);
}
