package com.flagship.credit_ledger.expiration;

import com.flagship.credit_ledger.credit.exception.ErrorKind;
import lombok.Value;

import java.util.UUID;

/**
 * One credit the sweep could not expire. kind is null for failures outside the ledger's
 * own error model, such as a lost database connection.
 */
@Value
public class SweepFailure {
    UUID creditId;
    ErrorKind kind;
    String message;
}
