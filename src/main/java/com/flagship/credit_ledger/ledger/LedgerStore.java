package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.credit.CreditPosting;
import com.flagship.credit_ledger.credit.CreditStatus;
import com.flagship.credit_ledger.credit.CreditTransaction;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Persistence for credits and their append-only transaction history.
 *
 * Mutations go through {@link #withCreditLock}, which serializes writers per credit
 * (never per table) and applies the balance update and the transaction insert as one
 * atomic unit. Transactions are never updated or deleted, and credits are never deleted.
 */
public interface LedgerStore {

    /**
     * Locks one credit, hands its current state to the mutation and persists the returned
     * posting.
     *
     * If the mutation throws, nothing is written and the exception propagates unchanged.
     *
     * @param creditId credit to lock
     * @param mutation computes the new state and the single entry explaining it
     * @return the persisted posting, with version and sequence number assigned by the store
     * @throws com.flagship.credit_ledger.credit.exception.CreditNotFoundException if the credit does not exist
     * @throws com.flagship.credit_ledger.credit.exception.CreditConcurrentModificationException if the lock
     *         could not be acquired in time or the row changed between read and write
     */
    CreditPosting withCreditLock(UUID creditId, Function<Credit, CreditPosting> mutation);

    /**
     * Inserts a freshly issued credit together with its ISSUE entry.
     *
     * @param idempotencyKey optional caller key, unique across credits
     * @throws com.flagship.credit_ledger.credit.exception.CreditConcurrentModificationException if the code
     *         or idempotency key was taken concurrently
     */
    CreditPosting insertIssued(Credit credit, CreditTransaction issueTransaction, String idempotencyKey);

    Optional<Credit> findById(UUID creditId);

    Optional<Credit> findByCode(String code);

    Optional<Credit> findByIdempotencyKey(String idempotencyKey);

    boolean codeExists(String code);

    /**
     * Full history of one credit, oldest first.
     */
    List<CreditTransaction> findTransactions(UUID creditId);

    /**
     * Credits owned by a customer, newest first.
     *
     * @param includeTerminal whether USED, EXPIRED and CANCELLED credits are returned
     */
    List<Credit> findByCustomer(String customerId, boolean includeTerminal);

    /**
     * One page of ACTIVE credits whose expiration date is at or before asOf, ordered by id.
     *
     * @param afterId keyset cursor, exclusive; null for the first page
     */
    List<UUID> findExpiredActiveIds(Instant asOf, UUID afterId, int limit);

    /**
     * ACTIVE credits with a positive balance expiring in (fromExclusive, toInclusive],
     * soonest first.
     */
    List<Credit> findActiveExpiringBetween(Instant fromExclusive, Instant toInclusive);

    /**
     * Transactions matching the filter within the range, oldest first.
     */
    List<CreditTransaction> findTransactions(TransactionFilter filter, DateRange range);

    Map<CreditStatus, Long> countByStatus();
}
