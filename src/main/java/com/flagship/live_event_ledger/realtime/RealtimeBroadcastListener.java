package com.flagship.live_event_ledger.realtime;

import com.flagship.live_event_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands committed broadcasts to the {@link RealtimeBroadcaster}. A failure
 * here is logged and dropped; the financial transaction is already durable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeBroadcastListener {

    private final RealtimeBroadcaster broadcaster;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBroadcastRequested(RealtimeBroadcastRequested request) {
        try {
            String correlationId = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
            broadcaster.broadcast(request.getRoomId(), request.getMessage().withCorrelationId(correlationId));
        } catch (Exception e) {
            log.error("Realtime broadcast failed: room={}, type={}, error={}",
                    request.getRoomId(), request.getMessage().getType(), e.getMessage());
        }
    }
}
