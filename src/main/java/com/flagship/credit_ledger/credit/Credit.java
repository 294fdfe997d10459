package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.credit.exception.AdjustmentOutOfRangeException;
import com.flagship.credit_ledger.credit.exception.AlreadyTerminalException;
import com.flagship.credit_ledger.credit.exception.CreditNotActiveException;
import com.flagship.credit_ledger.credit.exception.InsufficientBalanceException;
import com.flagship.credit_ledger.credit.exception.InvalidAmountException;
import com.flagship.credit_ledger.credit.exception.InvalidExpirationDateException;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Store credit domain object.
 *
 * Immutable: every transition validates against the current state and returns a new
 * Credit. Nothing is written until the ledger store persists the result together with
 * the matching transaction, so a rejected transition has no side effects.
 *
 * Invariant: 0 <= balance <= originalAmount, except when upward adjustments beyond the
 * original amount are explicitly enabled.
 */
@Value
public class Credit {
    UUID id;
    String code;
    BigDecimal originalAmount;
    BigDecimal balance;
    CurrencyCode currency;
    CreditStatus status;
    Instant expirationDate;
    String customerId;
    String note;
    @With
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE credit whose balance equals the issued amount.
     *
     * @throws InvalidAmountException if amount is missing or not positive
     * @throws InvalidExpirationDateException if expirationDate is not after now
     */
    public static Credit issue(UUID id, String code, BigDecimal amount, CurrencyCode currency,
                               Instant expirationDate, String customerId, String note, Instant now) {
        requireIssuable(amount, currency, expirationDate, now);
        return new Credit(id, code, amount, amount, currency, CreditStatus.ACTIVE,
            expirationDate, customerId, note, 0L, now, now);
    }

    /**
     * Validates issuance input without building a credit, so a code is only drawn for
     * requests that can succeed.
     */
    public static void requireIssuable(BigDecimal amount, CurrencyCode currency, Instant expirationDate, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Credit amount must be positive, got " + amount);
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (expirationDate != null && !expirationDate.isAfter(now)) {
            throw new InvalidExpirationDateException(
                "Expiration date must be in the future, got " + expirationDate);
        }
    }

    /**
     * Consumes part or all of the balance. A balance of exactly zero moves the credit to USED.
     *
     * @throws CreditNotActiveException if the credit is not ACTIVE or already past its expiration date
     * @throws InvalidAmountException if amount is not positive
     * @throws InsufficientBalanceException if amount exceeds the balance
     */
    public Credit redeem(BigDecimal amount, Instant now) {
        requireActive("redeem");
        if (isPastExpiration(now)) {
            throw new CreditNotActiveException(String.format(
                "Credit %s expired at %s and can no longer be redeemed", id, expirationDate));
        }
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Redemption amount must be positive, got " + amount);
        }
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientBalanceException(String.format(
                "Insufficient balance on credit %s. Available: %s, requested: %s", id, balance, amount));
        }
        return withBalance(balance.subtract(amount), now);
    }

    /**
     * Moves the balance up or down by delta. A resulting balance of zero moves the credit to USED.
     *
     * @param allowAboveOriginal whether the balance may exceed the original amount
     * @throws CreditNotActiveException if the credit is not ACTIVE or already past its expiration date
     * @throws AdjustmentOutOfRangeException if the result leaves the permitted range
     */
    public Credit adjust(BigDecimal delta, boolean allowAboveOriginal, Instant now) {
        requireActive("adjust");
        if (isPastExpiration(now)) {
            throw new CreditNotActiveException(String.format(
                "Credit %s expired at %s and can no longer be adjusted", id, expirationDate));
        }
        if (delta == null || delta.signum() == 0) {
            throw new InvalidAmountException("Adjustment must be non-zero, got " + delta);
        }
        BigDecimal newBalance = balance.add(delta);
        if (newBalance.signum() < 0) {
            throw new AdjustmentOutOfRangeException(String.format(
                "Adjustment of %s would make balance of credit %s negative (current %s)", delta, id, balance));
        }
        if (!allowAboveOriginal && newBalance.compareTo(originalAmount) > 0) {
            throw new AdjustmentOutOfRangeException(String.format(
                "Adjustment of %s would raise balance of credit %s above original amount %s (current %s)",
                delta, id, originalAmount, balance));
        }
        return withBalance(newBalance, now);
    }

    /**
     * Writes off the remaining balance and moves the credit to CANCELLED.
     *
     * @throws AlreadyTerminalException if the credit is USED, EXPIRED or CANCELLED
     */
    public Credit cancel(Instant now) {
        requireNotTerminal("cancel");
        return new Credit(id, code, originalAmount, BigDecimal.ZERO, currency, CreditStatus.CANCELLED,
            expirationDate, customerId, note, version, createdAt, now);
    }

    /**
     * Writes off the remaining balance and moves the credit to EXPIRED.
     *
     * @param asOf the instant the sweep considers "now"; only decides whether the credit is due
     * @param now when the transition is written, stamped as updatedAt
     * @throws AlreadyTerminalException if the credit is USED, EXPIRED or CANCELLED
     * @throws InvalidExpirationDateException if the credit has not reached its expiration date
     */
    public Credit expire(Instant asOf, Instant now) {
        requireNotTerminal("expire");
        if (expirationDate == null || expirationDate.isAfter(asOf)) {
            throw new InvalidExpirationDateException(String.format(
                "Credit %s is not due to expire as of %s (expiration date %s)", id, asOf, expirationDate));
        }
        return new Credit(id, code, originalAmount, BigDecimal.ZERO, currency, CreditStatus.EXPIRED,
            expirationDate, customerId, note, version, createdAt, now);
    }

    /**
     * Pushes the expiration date further out. Balance and status are unchanged.
     *
     * @throws InvalidExpirationDateException if the new date is not in the future or not later than the current one
     */
    public Credit extendExpiration(Instant newExpirationDate, Instant now) {
        requireActive("extend expiration of");
        if (newExpirationDate == null || !newExpirationDate.isAfter(now)) {
            throw new InvalidExpirationDateException(
                "New expiration date must be in the future, got " + newExpirationDate);
        }
        if (expirationDate == null) {
            throw new InvalidExpirationDateException(String.format(
                "Credit %s never expires; there is no expiration date to extend", id));
        }
        if (!newExpirationDate.isAfter(expirationDate)) {
            throw new InvalidExpirationDateException(String.format(
                "New expiration date %s must be later than current expiration date %s",
                newExpirationDate, expirationDate));
        }
        return new Credit(id, code, originalAmount, balance, currency, status,
            newExpirationDate, customerId, note, version, createdAt, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isPastExpiration(Instant now) {
        return expirationDate != null && !expirationDate.isAfter(now);
    }

    /**
     * Checks if a transition from the current status to the target status is allowed.
     */
    public boolean canTransitionTo(CreditStatus targetStatus) {
        if (this.status == targetStatus) {
            return true;
        }

        return switch (this.status) {
            case ACTIVE -> true;
            case USED, EXPIRED, CANCELLED -> false;
        };
    }

    private Credit withBalance(BigDecimal newBalance, Instant now) {
        CreditStatus newStatus = newBalance.signum() == 0 ? CreditStatus.USED : status;
        return new Credit(id, code, originalAmount, newBalance, currency, newStatus,
            expirationDate, customerId, note, version, createdAt, now);
    }

    private void requireActive(String action) {
        if (status != CreditStatus.ACTIVE) {
            throw new CreditNotActiveException(String.format(
                "Cannot %s credit %s in %s status. Only ACTIVE credits can change.", action, id, status));
        }
    }

    private void requireNotTerminal(String action) {
        if (status.isTerminal()) {
            throw new AlreadyTerminalException(String.format(
                "Cannot %s credit %s: it is already %s", action, id, status));
        }
    }
}
