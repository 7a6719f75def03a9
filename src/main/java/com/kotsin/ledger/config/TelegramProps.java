package com.kotsin.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "telegram")
public record TelegramProps(
        @DefaultValue("") String botToken,
        @DefaultValue("https://api.telegram.org") String baseUrl,
        @DefaultValue("30") int pollTimeoutSeconds,
        @DefaultValue("2000") long pollIntervalMs,
        @DefaultValue("true") boolean startFromLatest
) {

    public boolean isConfigured() {
        return botToken != null && !botToken.isBlank();
    }
}
