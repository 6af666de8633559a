package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.dto.PurchaseTicketRequest;
import com.flagship.live_event_ledger.event.dto.TicketResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;
    private final TicketRefundService ticketRefundService;

    @PostMapping("/api/events/{eventId}/tickets")
    public ResponseEntity<TicketResponse> purchaseTicket(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID fanId,
            @Valid @RequestBody PurchaseTicketRequest request) {
        EventTicket ticket = ticketService.purchaseTicket(eventId, fanId, request.getPriceCents());
        return ResponseEntity.status(HttpStatus.CREATED).body(TicketResponse.from(ticket));
    }

    @GetMapping("/api/events/{eventId}/tickets/mine")
    public ResponseEntity<TicketResponse> getMyTicket(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID fanId) {
        return ticketService.findTicket(eventId, fanId)
            .map(ticket -> ResponseEntity.ok(TicketResponse.from(ticket)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Creator refunds one ticket. Repeating the call returns the refunded ticket.
     */
    @PostMapping("/api/tickets/{ticketId}/refund")
    public ResponseEntity<TicketResponse> refundTicket(
            @PathVariable("ticketId") UUID ticketId,
            @RequestHeader(UserHeaders.USER_ID) UUID creatorId) {
        return ResponseEntity.ok(TicketResponse.from(ticketRefundService.refundTicket(ticketId, creatorId)));
    }
}
