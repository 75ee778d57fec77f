package com.flagship.broker_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the settlement engine.
 *
 * Metrics exposed:
 * - ledger.settlements: settlements by direction and outcome
 * - ledger.settlement.duration: settlement latency
 * - ledger.settlement.duplicates: idempotent replays
 * - ledger.invariant.violations: aborted units
 * - ledger.concurrency.conflicts: lock timeouts and uniqueness races
 * - ledger.episodes: episodes opened and closed, by direction
 * - ledger.cache.drift: caches found out of step with the ledger
 * - ledger.episodes.open: open episodes across all accounts
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter duplicates;
    private final Counter invariantViolations;
    private final Counter concurrencyConflicts;
    private final Counter cacheDrift;
    private final AtomicLong openEpisodes = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicates = Counter.builder("ledger.settlement.duplicates")
                .description("Settlement requests answered from an earlier identical settlement")
                .register(registry);

        this.invariantViolations = Counter.builder("ledger.invariant.violations")
                .description("Mutations rolled back because an invariant failed")
                .register(registry);

        this.concurrencyConflicts = Counter.builder("ledger.concurrency.conflicts")
                .description("Mutations rejected by a lock timeout or a uniqueness race")
                .register(registry);

        this.cacheDrift = Counter.builder("ledger.cache.drift")
                .description("Account caches found out of step with the ledger")
                .register(registry);

        Gauge.builder("ledger.episodes.open", openEpisodes, AtomicLong::get)
                .description("Unsettled loss and profit episodes")
                .register(registry);
    }

    public void recordSettlement(String direction, String outcome) {
        registry.counter("ledger.settlements",
                "direction", sanitizeTag(direction),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordSettlementLatency(String direction, long durationMs) {
        Timer.builder("ledger.settlement.duration")
                .tag("direction", sanitizeTag(direction))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void incrementDuplicates() {
        duplicates.increment();
    }

    public void incrementInvariantViolations() {
        invariantViolations.increment();
    }

    public void incrementConcurrencyConflicts() {
        concurrencyConflicts.increment();
    }

    public void incrementCacheDrift() {
        cacheDrift.increment();
    }

    public void recordEpisodeOpened(String direction) {
        registry.counter("ledger.episodes", "direction", sanitizeTag(direction), "event", "opened").increment();
    }

    public void recordEpisodeClosed(String direction) {
        registry.counter("ledger.episodes", "direction", sanitizeTag(direction), "event", "closed").increment();
    }

    public void updateOpenEpisodes(long count) {
        openEpisodes.set(count);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
