package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.dto.SendTipRequest;
import com.flagship.live_event_ledger.event.dto.TipResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/events/{eventId}/tips")
@RequiredArgsConstructor
public class TipController {

    private final TipService tipService;
    private final LiveEventService liveEventService;

    /**
     * 201 for a new tip; 200 with the original tip when the
     * Idempotency-Key was already used.
     */
    @PostMapping
    public ResponseEntity<TipResponse> sendTip(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID fromUserId,
            @RequestHeader(name = UserHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody SendTipRequest request) {
        TipOutcome outcome = tipService.sendTip(
            eventId,
            fromUserId,
            request.getToUserId(),
            request.getAmountCents(),
            request.getMessage(),
            request.isAnonymousTip(),
            idempotencyKey
        );
        HttpStatus status = outcome.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TipResponse.from(outcome.getTip()));
    }

    @GetMapping
    public ResponseEntity<List<TipResponse>> getEventTips(
            @PathVariable("eventId") UUID eventId,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        List<TipResponse> tips = liveEventService.getEventTips(eventId, limit)
            .stream()
            .map(TipResponse::from)
            .toList();
        return ResponseEntity.ok(tips);
    }
}
