package com.flagship.broker_ledger.observability;

import com.flagship.broker_ledger.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final SnapshotStore snapshotStore;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        try {
            outboxMetrics.refresh();
            ledgerMetrics.updateOpenEpisodes(snapshotStore.findAllActive().size());
        } catch (RuntimeException e) {
            log.warn("Failed to refresh gauges: {}", e.getMessage());
        }
    }
}
