package com.kotsin.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot entry point for the fill ledger sync service.
 *
 * Polls the notification channel for brokerage fill messages and exchange sync commands,
 * and records each fill into the matching spreadsheet ledger.
 */
@SpringBootApplication
@EnableScheduling
public class LedgerSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerSyncApplication.class, args);
    }
}
