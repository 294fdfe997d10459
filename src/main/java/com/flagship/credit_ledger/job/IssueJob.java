package com.flagship.credit_ledger.job;

import com.flagship.credit_ledger.credit.IssueCreditCommand;
import lombok.Value;

import java.util.List;

/**
 * Bulk issuance, for example a promotion crediting many customers. Each command succeeds
 * or fails on its own.
 */
@Value
public final class IssueJob implements LedgerJob {
    List<IssueCreditCommand> commands;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIssue(this);
    }
}
