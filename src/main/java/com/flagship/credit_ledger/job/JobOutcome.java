package com.flagship.credit_ledger.job;

import lombok.Value;

import java.util.List;

@Value
public class JobOutcome {
    String jobType;
    int succeeded;
    int failed;
    List<String> messages;

    public boolean isClean() {
        return failed == 0;
    }
}
