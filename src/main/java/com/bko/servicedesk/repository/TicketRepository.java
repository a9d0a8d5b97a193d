package com.bko.servicedesk.repository;

import com.bko.servicedesk.entity.Ticket;
import com.bko.servicedesk.entity.TicketPriority;
import com.bko.servicedesk.entity.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for managing {@link Ticket} entities.
 */
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    @Query("""
            select t from Ticket t join fetch t.customer c
            where c.id = :customerId
            order by t.createdAt desc, t.id desc
            """)
    List<Ticket> findHistory(@Param("customerId") Long customerId);

    @Query("""
            select t from Ticket t join fetch t.customer c
            where t.priority = :priority
            order by t.createdAt desc, t.id desc
            """)
    List<Ticket> findByPriority(@Param("priority") TicketPriority priority);

    @Query("""
            select t from Ticket t join fetch t.customer c
            where t.priority = :priority and c.id in :customerIds
            order by t.createdAt desc, t.id desc
            """)
    List<Ticket> findByPriorityForCustomers(@Param("priority") TicketPriority priority,
                                            @Param("customerIds") Collection<Long> customerIds);

    @Query("""
            select c.id as customerId, count(t.id) as openCount
            from Ticket t join t.customer c
            where t.status = :status
            group by c.id
            order by count(t.id) desc, c.id asc
            """)
    List<OpenTicketCount> countByStatusPerCustomer(@Param("status") TicketStatus status);
}
