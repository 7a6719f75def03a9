package com.kotsin.ledger.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.ledger.config.LedgerProps;
import com.kotsin.ledger.grid.GoogleDriveClient;
import com.kotsin.ledger.grid.SheetRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Exports a spreadsheet to a local xlsx file before it is first written in a given context.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SpreadsheetBackupService {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final GoogleDriveClient driveClient;
    private final Cache<String, Boolean> spreadsheetBackupCache;
    private final LedgerProps props;
    private final Clock clock;

    public void ensureBackupOnce(SheetRef sheet, String context, String bucket) {
        if (!props.backupEnabled()) return;
        String key = sheet.spreadsheetId() + ":" + context + ":" + bucket;
        if (spreadsheetBackupCache.getIfPresent(key) != null) return;

        Path path = backup(sheet, context, bucket);
        spreadsheetBackupCache.put(key, Boolean.TRUE);
        log.info("spreadsheet_backup_done path={}", path);
    }

    Path backup(SheetRef sheet, String context, String bucket) {
        Path dir = Path.of(props.backupDir()).resolve(safe(bucket, "misc"));
        String fileName = TS.format(LocalDateTime.now(clock)) + "_"
                + safe(sheet.spreadsheetTitle(), "spreadsheet") + "_"
                + sheet.spreadsheetId() + "_"
                + safe(context, "run") + ".xlsx";
        byte[] xlsx = driveClient.exportXlsx(sheet.spreadsheetId());
        try {
            Files.createDirectories(dir);
            return Files.write(dir.resolve(fileName), xlsx);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write backup into " + dir, e);
        }
    }

    static String safe(String text, String fallback) {
        String s = (text == null ? "" : text).replaceAll("[^0-9A-Za-z._-]+", "_");
        s = s.replaceAll("^_+|_+$", "");
        return s.isEmpty() ? fallback : s;
    }
}
