package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.event.CreditEvent;
import com.flagship.credit_ledger.credit.exception.CreditNotFoundException;
import com.flagship.credit_ledger.ledger.LedgerStore;
import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies credit state transitions and records each one in the ledger.
 *
 * Every mutating method is one database transaction: the credit row update, the single
 * appended ledger entry and the outbox event commit or roll back together. The transition
 * rules themselves live on {@link Credit}; this class only decides what entry explains the
 * new state.
 *
 * Callers should go through {@link CreditLedgerService}, which retries lock conflicts and
 * dispatches notifications once the transaction has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLifecycleEngine {

    static final String META_PREVIOUS_EXPIRATION = "previousExpirationDate";
    static final String META_NEW_EXPIRATION = "newExpirationDate";
    static final String META_REASON = "reason";

    private final LedgerStore ledgerStore;
    private final CreditCodeGenerator codeGenerator;
    private final OutboxService outboxService;
    private final CreditLedgerProperties properties;
    private final Clock clock;

    /**
     * Issues a new ACTIVE credit.
     *
     * If the command carries an idempotency key that was already used, the credit created by
     * that earlier request is returned and nothing is written.
     */
    @Transactional
    public LedgerResult issue(IssueCreditCommand command) {
        if (command.getIdempotencyKey() != null) {
            Optional<Credit> existing = ledgerStore.findByIdempotencyKey(command.getIdempotencyKey());
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning credit {}", existing.get().getId());
                return replay(existing.get());
            }
        }

        Instant now = clock.instant();
        Credit.requireIssuable(command.getAmount(), command.getCurrency(), command.getExpirationDate(), now);

        Credit credit = Credit.issue(
            UUID.randomUUID(),
            codeGenerator.generateCode(),
            command.getAmount(),
            command.getCurrency(),
            command.getExpirationDate(),
            command.getCustomerId(),
            command.getNote(),
            now
        );
        CreditTransaction issue = CreditTransaction.against(credit, TransactionType.ISSUE, credit.getOriginalAmount(), now)
            .staffId(command.getStaffId())
            .locationId(command.getLocationId())
            .note(command.getNote())
            .build();

        CreditPosting posting = ledgerStore.insertIssued(credit, issue, command.getIdempotencyKey());
        log.info("Issued credit {} ({}) for {} {}", credit.getId(), credit.getCode(),
            credit.getOriginalAmount(), credit.getCurrency());
        return record(posting);
    }

    /**
     * Consumes part or all of the balance of an ACTIVE, unexpired credit.
     */
    @Transactional
    public LedgerResult redeem(RedeemCreditCommand command) {
        Instant now = clock.instant();
        CreditPosting posting = ledgerStore.withCreditLock(command.getCreditId(), current -> {
            Credit after = current.redeem(command.getAmount(), now);
            CreditTransaction tx = CreditTransaction.against(after, TransactionType.REDEEM, command.getAmount().negate(), now)
                .staffId(command.getStaffId())
                .locationId(command.getLocationId())
                .orderId(command.getOrderId())
                .orderNumber(command.getOrderNumber())
                .note(command.getNote())
                .build();
            return new CreditPosting(after, tx);
        });
        return record(posting);
    }

    /**
     * Moves the balance by a signed delta.
     *
     * @param reason required; kept as the entry's note
     */
    @Transactional
    public LedgerResult adjust(UUID creditId, BigDecimal delta, String reason, String staffId) {
        requireReason(reason, "Adjustment");
        boolean allowAboveOriginal = properties.getAdjust().isAllowAboveOriginal();
        Instant now = clock.instant();
        CreditPosting posting = ledgerStore.withCreditLock(creditId, current -> {
            Credit after = current.adjust(delta, allowAboveOriginal, now);
            CreditTransaction tx = CreditTransaction.against(after, TransactionType.ADJUST, delta, now)
                .staffId(staffId)
                .note(reason)
                .build();
            return new CreditPosting(after, tx);
        });
        return record(posting);
    }

    /**
     * Writes off the remaining balance and moves the credit to CANCELLED.
     */
    @Transactional
    public LedgerResult cancel(UUID creditId, String reason, String staffId) {
        Instant now = clock.instant();
        CreditPosting posting = ledgerStore.withCreditLock(creditId, current -> {
            Credit after = current.cancel(now);
            CreditTransaction tx = CreditTransaction.against(after, TransactionType.CANCEL, current.getBalance().negate(), now)
                .staffId(staffId)
                .note(reason)
                .build();
            return new CreditPosting(after, tx);
        });
        return record(posting);
    }

    /**
     * Moves the expiration date later. Recorded as a zero-amount entry whose metadata holds
     * the previous and the new date.
     */
    @Transactional
    public LedgerResult extendExpiration(UUID creditId, Instant newExpirationDate, String reason, String staffId) {
        requireReason(reason, "Expiration extension");
        Instant now = clock.instant();
        CreditPosting posting = ledgerStore.withCreditLock(creditId, current -> {
            Credit after = current.extendExpiration(newExpirationDate, now);
            CreditTransaction tx = CreditTransaction.against(after, TransactionType.EXTEND_EXPIRATION, BigDecimal.ZERO, now)
                .staffId(staffId)
                .note(reason)
                .metadataEntry(META_PREVIOUS_EXPIRATION, current.getExpirationDate().toString())
                .metadataEntry(META_NEW_EXPIRATION, newExpirationDate.toString())
                .metadataEntry(META_REASON, reason)
                .build();
            return new CreditPosting(after, tx);
        });
        return record(posting);
    }

    /**
     * Expires a credit that reached its expiration date on or before asOf.
     * Used by the expiration sweep. The entry is stamped when it is written, not with asOf.
     */
    @Transactional
    public LedgerResult expire(UUID creditId, Instant asOf) {
        Instant now = clock.instant();
        CreditPosting posting = ledgerStore.withCreditLock(creditId, current -> {
            Credit after = current.expire(asOf, now);
            CreditTransaction tx = CreditTransaction.against(after, TransactionType.EXPIRE, current.getBalance().negate(), now)
                .note("Expired on " + current.getExpirationDate())
                .build();
            return new CreditPosting(after, tx);
        });
        return record(posting);
    }

    @Transactional(readOnly = true)
    public Credit getCredit(UUID creditId) {
        return ledgerStore.findById(creditId)
            .orElseThrow(() -> new CreditNotFoundException("Credit not found: " + creditId));
    }

    /**
     * Looks a credit up by code. Malformed codes are rejected without a query.
     */
    @Transactional(readOnly = true)
    public Optional<Credit> findByCode(String code) {
        if (!CreditCodeGenerator.isWellFormed(code)) {
            log.debug("Rejected malformed credit code lookup: {}", code);
            return Optional.empty();
        }
        return ledgerStore.findByCode(code);
    }

    /**
     * Full history of a credit, oldest first.
     */
    @Transactional(readOnly = true)
    public List<CreditTransaction> getHistory(UUID creditId) {
        getCredit(creditId);
        return ledgerStore.findTransactions(creditId);
    }

    @Transactional(readOnly = true)
    public List<Credit> findCreditsByCustomer(String customerId, boolean includeTerminal) {
        return ledgerStore.findByCustomer(customerId, includeTerminal);
    }

    private LedgerResult record(CreditPosting posting) {
        CreditEvent event = CreditEvent.fromPosting(posting.getCredit(), posting.getTransaction());
        outboxService.saveEvent(CreditEvent.AGGREGATE_TYPE, posting.getCredit().getId(), event.getEventType(), event);
        return LedgerResult.committed(posting, event);
    }

    private LedgerResult replay(Credit credit) {
        CreditTransaction issue = ledgerStore.findTransactions(credit.getId()).stream()
            .filter(tx -> tx.getType() == TransactionType.ISSUE)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Credit " + credit.getId() + " has no ISSUE entry"));
        return LedgerResult.replayed(credit, issue);
    }

    private static void requireReason(String reason, String operation) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException(operation + " reason is required");
        }
    }
}
