package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.realtime.RealtimeBroadcastRequested;
import com.flagship.live_event_ledger.realtime.RealtimeMessage;
import com.flagship.live_event_ledger.realtime.RealtimeRooms;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds the room broadcasts for an event. Everything queued here is sent
 * only after the surrounding transaction commits.
 */
@Component
@RequiredArgsConstructor
class EventBroadcasts {

    static final String ACTION_USER_JOINED = "user_joined";
    static final String ACTION_USER_LEFT = "user_left";

    private final ApplicationEventPublisher eventPublisher;

    void started(LiveEvent event) {
        statusUpdate(event, event.getTitle() + " has started!");
    }

    void ended(LiveEvent event) {
        statusUpdate(event, event.getTitle() + " has ended. Thanks for attending!");
    }

    void cancelled(LiveEvent event) {
        statusUpdate(event, "Event '" + event.getTitle() + "' has been cancelled. All tickets have been refunded.");
    }

    void userJoined(UUID eventId, UUID userId, long currentViewers) {
        viewerChange(eventId, userId, ACTION_USER_JOINED, currentViewers, "Someone joined the event");
    }

    void userLeft(UUID eventId, UUID userId, long currentViewers) {
        viewerChange(eventId, userId, ACTION_USER_LEFT, currentViewers, "Someone left the event");
    }

    /**
     * Anonymous tips are broadcast without the sender.
     */
    void tip(EventTip tip) {
        publish(tip.getEventId(), RealtimeMessage.tip(RealtimeMessage.Payload.builder()
            .eventId(tip.getEventId())
            .tipId(tip.getId())
            .amountCents(tip.getAmountCents())
            .message(tip.getMessage())
            .anonymous(tip.isAnonymous())
            .fromUserId(tip.isAnonymous() ? null : tip.getFromUserId())
            .toUserId(tip.getToUserId())
            .build()));
    }

    private void statusUpdate(LiveEvent event, String message) {
        publish(event.getId(), RealtimeMessage.streamUpdate(RealtimeMessage.Payload.builder()
            .eventId(event.getId())
            .status(event.getStatus().name().toLowerCase(Locale.ROOT))
            .title(event.getTitle())
            .actualStartAt(event.getActualStartAt())
            .actualEndAt(event.getActualEndAt())
            .message(message)
            .build()));
    }

    private void viewerChange(UUID eventId, UUID userId, String action, long currentViewers, String message) {
        publish(eventId, RealtimeMessage.streamUpdate(RealtimeMessage.Payload.builder()
            .eventId(eventId)
            .action(action)
            .userId(userId)
            .currentViewers(currentViewers)
            .message(message)
            .build()));
    }

    private void publish(UUID eventId, RealtimeMessage message) {
        eventPublisher.publishEvent(new RealtimeBroadcastRequested(RealtimeRooms.forEvent(eventId), message));
    }
}
