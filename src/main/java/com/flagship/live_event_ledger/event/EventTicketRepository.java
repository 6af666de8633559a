package com.flagship.live_event_ledger.event;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventTicketRepository extends JpaRepository<EventTicketEntity, UUID> {

    boolean existsByEventIdAndFanId(UUID eventId, UUID fanId);

    boolean existsByEventIdAndFanIdAndRefundedAtIsNull(UUID eventId, UUID fanId);

    /**
     * Seats taken. Refunded tickets release their seat.
     */
    long countByEventIdAndRefundedAtIsNull(UUID eventId);

    long countByEventId(UUID eventId);

    @Query("SELECT t.id FROM EventTicketEntity t WHERE t.eventId = :eventId AND t.refundedAt IS NULL " +
           "ORDER BY t.purchasedAt ASC")
    List<UUID> findOutstandingTicketIds(@Param("eventId") UUID eventId);

    /**
     * Scalar lookup, so the ticket is not loaded before it is locked.
     */
    @Query("SELECT t.eventId FROM EventTicketEntity t WHERE t.id = :id")
    Optional<UUID> findEventIdById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM EventTicketEntity t WHERE t.id = :id")
    Optional<EventTicketEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<EventTicketEntity> findByEventIdAndFanId(UUID eventId, UUID fanId);
}
