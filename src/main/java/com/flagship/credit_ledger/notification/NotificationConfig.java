package com.flagship.credit_ledger.notification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfig {

    @Bean
    @ConditionalOnMissingBean(CreditNotificationHook.class)
    public CreditNotificationHook loggingNotificationHook() {
        return new LoggingNotificationHook();
    }
}
