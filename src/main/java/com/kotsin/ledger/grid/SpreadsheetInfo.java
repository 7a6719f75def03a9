package com.kotsin.ledger.grid;

import java.util.List;

public record SpreadsheetInfo(String spreadsheetId, String title, List<String> worksheetNames) {
}
