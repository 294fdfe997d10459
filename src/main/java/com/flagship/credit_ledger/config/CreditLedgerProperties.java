package com.flagship.credit_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code credit-ledger} prefix.
 */
@ConfigurationProperties(prefix = "credit-ledger")
@Getter
@Setter
public class CreditLedgerProperties {

    private final Code code = new Code();
    private final Store store = new Store();
    private final Retry retry = new Retry();
    private final Adjust adjust = new Adjust();
    private final Sweep sweep = new Sweep();
    private final Reminders reminders = new Reminders();

    @Getter
    @Setter
    public static class Code {
        /** Attempts at drawing an unused code before giving up. */
        private int maxAttempts = 5;
    }

    @Getter
    @Setter
    public static class Store {
        /** Longest wait for a credit's row lock. */
        private Duration lockTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class Adjust {
        private boolean allowAboveOriginal = false;
    }

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = true;
        private String cron = "0 0 3 * * *";
        private int batchSize = 200;
    }

    @Getter
    @Setter
    public static class Reminders {
        private boolean enabled = true;
        private String cron = "0 0 9 * * *";
        private List<Integer> days = new ArrayList<>(List.of(1, 7, 30));
    }
}
