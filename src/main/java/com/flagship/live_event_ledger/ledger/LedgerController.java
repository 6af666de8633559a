package com.flagship.live_event_ledger.ledger;

import com.flagship.live_event_ledger.ledger.dto.LedgerEntryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only audit endpoints over the ledger.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;

    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<List<LedgerEntryResponse>> getTransaction(@PathVariable("transactionId") UUID transactionId) {
        List<LedgerEntryResponse> entries = ledgerService.getEntriesForTransaction(transactionId)
            .stream()
            .map(LedgerEntryResponse::from)
            .toList();

        return entries.isEmpty()
            ? ResponseEntity.notFound().build()
            : ResponseEntity.ok(entries);
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationReport> reconcile() {
        return ResponseEntity.ok(ledgerService.reconcile());
    }
}
