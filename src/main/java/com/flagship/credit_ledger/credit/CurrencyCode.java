package com.flagship.credit_ledger.credit;

/**
 * Currency code enum following ISO-4217.
 *
 * Keeps unknown codes out of the ledger. A credit's currency never changes after issuance.
 */
public enum CurrencyCode {
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    CAD, // Canadian Dollar
    AUD, // Australian Dollar
    NZD, // New Zealand Dollar
    INR, // Indian Rupee
    JPY, // Japanese Yen
    // Add more currencies as needed
}
