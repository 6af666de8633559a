package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.exception.EventNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Serialises admission decisions for an event.
 *
 * Runs inside the purchase transaction: the event row lock taken here is
 * held until the ticket row is committed, so two buyers can never both see
 * the last free seat.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapacityGate {

    private final LiveEventRepository eventRepository;
    private final EventTicketRepository ticketRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public SlotReservation reserveSlot(UUID eventId) {
        LiveEventEntity event = eventRepository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));

        if (event.getMaxAttendees() == null) {
            return SlotReservation.GRANTED;
        }

        long taken = ticketRepository.countByEventIdAndRefundedAtIsNull(eventId);
        if (taken >= event.getMaxAttendees()) {
            log.info("Event {} sold out: taken={}, capacity={}", eventId, taken, event.getMaxAttendees());
            return SlotReservation.SOLD_OUT;
        }
        return SlotReservation.GRANTED;
    }
}
