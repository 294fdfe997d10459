package com.flagship.credit_ledger.credit;

/**
 * Status of a store credit.
 *
 * ACTIVE is the initial state and the only one from which the balance can change.
 * USED, EXPIRED and CANCELLED are terminal: once reached, neither status nor balance
 * changes again.
 */
public enum CreditStatus {
    /**
     * Credit can be redeemed, adjusted, extended, cancelled or expired.
     */
    ACTIVE,

    /**
     * Balance reached zero through redemption or a downward adjustment.
     */
    USED,

    /**
     * Expiration date passed and the sweeper zeroed the remaining balance.
     */
    EXPIRED,

    /**
     * Cancelled by staff; the remaining balance was written off.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
