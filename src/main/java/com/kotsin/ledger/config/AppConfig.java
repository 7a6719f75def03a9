package com.kotsin.ledger.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties({LedgerProps.class, UpbitProps.class, TelegramProps.class})
public class AppConfig {

    @Bean
    public OkHttpClient okHttpClient(@Value("${http.call-timeout-seconds:20}") long callTimeoutSeconds) {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(callTimeoutSeconds))
                .build();
    }

    @Bean
    public Clock clock(LedgerProps props) {
        return Clock.system(props.zoneId());
    }

    /**
     * Keys are "spreadsheetId:context:bucket"; the context carries the update id,
     * so each spreadsheet is exported at most once per processed update.
     */
    @Bean
    public Cache<String, Boolean> spreadsheetBackupCache(
            @Value("${ledger.backup-cache.max-entries:10000}") long maxEntries) {
        return Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(Duration.ofDays(1))
                .build();
    }
}
