package com.flagship.live_event_ledger.wallet;

import com.flagship.live_event_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.live_event_ledger.wallet.dto.WalletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final WalletService walletService;

    @GetMapping("/{userId}")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(WalletResponse.from(walletService.getWallet(userId)));
    }

    /**
     * Idempotent: opening an existing wallet returns it unchanged.
     */
    @PostMapping("/{userId}")
    public ResponseEntity<WalletResponse> openWallet(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(WalletResponse.from(walletService.openWallet(userId)));
    }

    @GetMapping("/{userId}/entries")
    public ResponseEntity<List<LedgerEntryResponse>> getHistory(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "limit", defaultValue = "50") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        List<LedgerEntryResponse> entries = walletService.getHistory(userId, limit, offset)
            .stream()
            .map(LedgerEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }
}
