package com.flagship.live_event_ledger.event;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventAttendanceRepository extends JpaRepository<EventAttendanceEntity, UUID> {

    Optional<EventAttendanceEntity> findByEventIdAndUserIdAndActiveTrue(UUID eventId, UUID userId);

    List<EventAttendanceEntity> findByEventIdAndActiveTrue(UUID eventId);

    long countByEventIdAndActiveTrue(UUID eventId);
}
