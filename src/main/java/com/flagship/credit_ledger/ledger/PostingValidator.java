package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.credit.CreditPosting;
import com.flagship.credit_ledger.credit.CreditTransaction;

import java.util.Objects;

/**
 * Last line of defence before a posting reaches storage.
 *
 * Rejects postings that would let the stored balance, the sum of entries and the latest
 * balanceAfter drift apart, or that touch a credit's immutable fields. A failure here is
 * a programming error, not a user error.
 */
public final class PostingValidator {

    private PostingValidator() {
        // Utility class
    }

    public static void validate(Credit current, CreditPosting posting) {
        Credit updated = posting.getCredit();
        CreditTransaction tx = posting.getTransaction();

        if (!current.getId().equals(updated.getId()) || !current.getId().equals(tx.getCreditId())) {
            throw new IllegalStateException("Posting for credit " + updated.getId()
                + " / transaction credit " + tx.getCreditId() + " does not match locked credit " + current.getId());
        }
        if (current.isTerminal() || !current.canTransitionTo(updated.getStatus())) {
            throw new IllegalStateException(String.format(
                "Credit %s cannot move from %s to %s", current.getId(), current.getStatus(), updated.getStatus()));
        }
        if (!current.getCode().equals(updated.getCode())
            || current.getOriginalAmount().compareTo(updated.getOriginalAmount()) != 0
            || current.getCurrency() != updated.getCurrency()
            || !Objects.equals(current.getCustomerId(), updated.getCustomerId())) {
            throw new IllegalStateException("Posting modifies immutable fields of credit " + current.getId());
        }
        if (updated.getBalance().signum() < 0) {
            throw new IllegalStateException("Posting leaves negative balance on credit " + current.getId());
        }
        if (tx.getBalanceAfter().compareTo(updated.getBalance()) != 0) {
            throw new IllegalStateException(String.format(
                "balanceAfter %s disagrees with new balance %s on credit %s",
                tx.getBalanceAfter(), updated.getBalance(), current.getId()));
        }
        if (current.getBalance().add(tx.getAmount()).compareTo(updated.getBalance()) != 0) {
            throw new IllegalStateException(String.format(
                "Entry amount %s does not explain balance change %s -> %s on credit %s",
                tx.getAmount(), current.getBalance(), updated.getBalance(), current.getId()));
        }
    }
}
