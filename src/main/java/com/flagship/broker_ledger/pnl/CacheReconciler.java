package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.account.AccountStore;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically rewrites drifted account caches from the ledger. Each
 * account is reconciled in its own transaction; one failing account does
 * not stop the sweep.
 */
@Component
@ConditionalOnProperty(name = "ledger.cache-reconciler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CacheReconciler {

    private final AccountStore accountStore;
    private final AccountStateService accountStateService;

    @Scheduled(fixedDelayString = "${ledger.cache-reconciler.interval-ms:300000}")
    public void scheduledSweep() {
        reconcileAll();
    }

    /**
     * @return number of accounts whose caches were corrected
     */
    public int reconcileAll() {
        int corrected = 0;
        for (ClientExchangeAccount account : accountStore.findAll()) {
            try {
                if (accountStateService.reconcile(account.getId())) {
                    corrected++;
                }
            } catch (RuntimeException e) {
                log.warn("Cache reconciliation failed: accountId={}, error={}", account.getId(), e.getMessage());
            }
        }
        if (corrected > 0) {
            log.info("Cache reconciliation corrected {} accounts", corrected);
        }
        return corrected;
    }
}
