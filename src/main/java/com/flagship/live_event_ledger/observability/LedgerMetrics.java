package com.flagship.live_event_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for money movement and event operations.
 *
 * Meters:
 * - ledger.transfers{type,outcome}: transfers, counted as committed only after commit
 * - events.tickets.purchased{outcome}
 * - events.tips{outcome}
 * - events.refunds{outcome}
 * - events.sold_out: capacity rejections
 * - ledger.integrity.errors: zero-row writes and balance drift
 * - events.cancellation.failures: refund cascades that stopped part way
 * - ledger.operation.latency{operation}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter soldOutRejections;
    private final Counter integrityErrors;
    private final Counter cancellationFailures;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.soldOutRejections = Counter.builder("events.sold_out")
                .description("Ticket purchases rejected because the event was at capacity")
                .register(registry);

        this.integrityErrors = Counter.builder("ledger.integrity.errors")
                .description("Wallet writes that affected no row or drifted from the computed balance")
                .register(registry);

        this.cancellationFailures = Counter.builder("events.cancellation.failures")
                .description("Event cancellations whose refund cascade did not complete")
                .register(registry);
    }

    public void recordTransfer(String transactionType, String outcome) {
        registry.counter("ledger.transfers",
                "type", sanitizeTag(transactionType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTicketPurchase(String outcome) {
        registry.counter("events.tickets.purchased", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordTip(String outcome) {
        registry.counter("events.tips", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRefund(String outcome) {
        registry.counter("events.refunds", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSoldOut() {
        soldOutRejections.increment();
    }

    public void recordIntegrityError() {
        integrityErrors.increment();
    }

    public void recordCancellationFailure() {
        cancellationFailures.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values low-cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
