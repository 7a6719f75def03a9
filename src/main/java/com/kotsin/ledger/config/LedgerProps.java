package com.kotsin.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "ledger")
public record LedgerProps(
        @DefaultValue("Asia/Seoul") String timeZone,
        @DefaultValue("") String worksheetName,       // blank = first worksheet
        @DefaultValue("") String spreadsheetIdMap,    // e.g. "TQQQ:1AbC...,BTC:1XyZ..."
        @DefaultValue("false") boolean fallbackOpenByTitle,
        @DefaultValue("state.json") String stateFile,
        @DefaultValue("true") boolean backupEnabled,
        @DefaultValue("spreadsheet_backups") String backupDir,
        @DefaultValue Cells cells
) {

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    /**
     * A1 addresses of the summary cells every ledger keeps at a fixed position.
     */
    public record Cells(
            @DefaultValue("R6") String avgPrice,
            @DefaultValue("B2") String currentPrice,
            @DefaultValue("R9") String zoneATarget,
            @DefaultValue("R10") String zoneBTarget,
            @DefaultValue("R11") String sellTarget,
            @DefaultValue("B3") String halfUnitAmount
    ) {
    }
}
