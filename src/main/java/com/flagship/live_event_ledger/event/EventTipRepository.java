package com.flagship.live_event_ledger.event;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventTipRepository extends JpaRepository<EventTipEntity, UUID> {

    Optional<EventTipEntity> findByFromUserIdAndIdempotencyKey(UUID fromUserId, String idempotencyKey);

    List<EventTipEntity> findByEventIdOrderByTippedAtDesc(UUID eventId, Pageable pageable);

    long countByEventId(UUID eventId);

    @Query("SELECT COALESCE(SUM(t.amountCents), 0) FROM EventTipEntity t WHERE t.eventId = :eventId")
    long sumAmountByEventId(@Param("eventId") UUID eventId);
}
