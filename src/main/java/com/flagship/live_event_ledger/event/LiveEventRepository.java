package com.flagship.live_event_ledger.event;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LiveEventRepository extends JpaRepository<LiveEventEntity, UUID> {

    /**
     * Locks the event row for the rest of the transaction. Every operation
     * that changes seating, lifecycle or counters takes this lock first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM LiveEventEntity e WHERE e.id = :id")
    Optional<LiveEventEntity> findByIdForUpdate(@Param("id") UUID id);

    List<LiveEventEntity> findAllByOrderByScheduledStartAtDesc(Pageable pageable);

    List<LiveEventEntity> findByStatusOrderByScheduledStartAtDesc(EventStatus status, Pageable pageable);

    List<LiveEventEntity> findByCreatorIdOrderByScheduledStartAtDesc(UUID creatorId);

    List<LiveEventEntity> findByCreatorIdAndStatusOrderByScheduledStartAtDesc(UUID creatorId, EventStatus status);

    @Query("SELECT e FROM LiveEventEntity e WHERE e.status = :status AND e.scheduledStartAt >= :from " +
           "ORDER BY e.scheduledStartAt ASC")
    List<LiveEventEntity> findUpcoming(@Param("status") EventStatus status,
                                       @Param("from") Instant from,
                                       Pageable pageable);

    List<LiveEventEntity> findByStatusOrderByPeakConcurrentViewersDesc(EventStatus status);
}
