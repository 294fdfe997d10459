package com.flagship.credit_ledger.expiration;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.CreditLedgerService;
import com.flagship.credit_ledger.credit.exception.CreditLedgerException;
import com.flagship.credit_ledger.credit.exception.ErrorKind;
import com.flagship.credit_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Expires every ACTIVE credit whose expiration date is at or before a given instant.
 *
 * Each credit is expired in its own transaction through {@link CreditLedgerService}, so
 * one failure never rolls back or stops the others. Candidates are paged by id, and the
 * cursor moves past failed credits, so a credit that keeps failing is reported once per
 * run instead of being retried in a loop. Running the sweep again for the same instant is
 * a no-op for credits it already expired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpirationSweeper {

    private final LedgerStore ledgerStore;
    private final CreditLedgerService creditLedgerService;
    private final CreditLedgerProperties properties;

    public SweepResult sweepExpired(Instant asOf) {
        int batchSize = properties.getSweep().getBatchSize();
        int expired = 0;
        int skipped = 0;
        List<SweepFailure> failures = new ArrayList<>();

        UUID cursor = null;
        List<UUID> page;
        do {
            page = ledgerStore.findExpiredActiveIds(asOf, cursor, batchSize);
            for (UUID creditId : page) {
                try {
                    creditLedgerService.expire(creditId, asOf);
                    expired++;
                } catch (CreditLedgerException e) {
                    if (e.getKind() == ErrorKind.ALREADY_TERMINAL) {
                        log.debug("Credit {} became terminal before the sweep reached it", creditId);
                        skipped++;
                    } else {
                        log.warn("Failed to expire credit {}: kind={}, message={}", creditId, e.getKind(), e.getMessage());
                        failures.add(new SweepFailure(creditId, e.getKind(), e.getMessage()));
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected error expiring credit {}", creditId, e);
                    failures.add(new SweepFailure(creditId, null, e.getMessage()));
                }
            }
            if (!page.isEmpty()) {
                cursor = page.get(page.size() - 1);
            }
        } while (page.size() == batchSize);

        log.info("Expiration sweep as of {}: expired={}, skipped={}, failed={}",
            asOf, expired, skipped, failures.size());
        return new SweepResult(asOf, expired, skipped, List.copyOf(failures));
    }
}
