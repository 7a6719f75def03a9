package com.kotsin.ledger.service;

import com.kotsin.ledger.config.LedgerProps;
import com.kotsin.ledger.error.LayoutException;
import com.kotsin.ledger.grid.GoogleDriveClient;
import com.kotsin.ledger.grid.GridStore;
import com.kotsin.ledger.grid.SheetRef;
import com.kotsin.ledger.grid.SpreadsheetInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a symbol to the worksheet of its ledger.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SpreadsheetLocator {

    static final String TITLE_SUFFIX = " 무한매수";

    private final GridStore gridStore;
    private final GoogleDriveClient driveClient;
    private final LedgerProps props;

    public SheetRef locate(String symbol) {
        String key = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        String spreadsheetId = parseIdMap(props.spreadsheetIdMap()).get(key);

        if (spreadsheetId == null) {
            if (!props.fallbackOpenByTitle()) {
                throw new IllegalStateException("ledger.spreadsheet-id-map has no entry for " + key
                        + " (e.g. ledger.spreadsheet-id-map=TQQQ:<spreadsheet_id>)");
            }
            String title = key + TITLE_SUFFIX;
            spreadsheetId = driveClient.findSpreadsheetIdByTitle(title)
                    .orElseThrow(() -> new IllegalStateException("no spreadsheet titled '" + title + "'"));
            log.info("spreadsheet_resolved_by_title symbol={} title={} id={}", key, title, spreadsheetId);
        }

        SpreadsheetInfo info = gridStore.describe(spreadsheetId);
        String worksheet = props.worksheetName();
        if (worksheet == null || worksheet.isBlank()) {
            if (info.worksheetNames().isEmpty()) {
                throw new LayoutException("spreadsheet " + spreadsheetId + " has no worksheets");
            }
            worksheet = info.worksheetNames().get(0);
        } else if (!info.worksheetNames().contains(worksheet)) {
            throw new LayoutException("worksheet '" + worksheet + "' not found in " + info.title());
        }
        return new SheetRef(spreadsheetId, info.title(), worksheet);
    }

    /**
     * Parses "SYMBOL:id,SYMBOL:id". Malformed or empty pairs are ignored; symbols are upper-cased.
     */
    static Map<String, String> parseIdMap(String raw) {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null) return out;
        for (String item : raw.split(",")) {
            String pair = item.trim();
            int sep = pair.indexOf(':');
            if (pair.isEmpty() || sep < 0) continue;
            String symbol = pair.substring(0, sep).trim().toUpperCase(Locale.ROOT);
            String id = pair.substring(sep + 1).trim();
            if (!symbol.isEmpty() && !id.isEmpty()) {
                out.put(symbol, id);
            }
        }
        return out;
    }
}
