package com.flagship.credit_ledger.reporting;

/**
 * Result of {@link ReportingProjection#aggregate}.
 */
public interface AggregateResult {

    GroupBy getGroupBy();
}
