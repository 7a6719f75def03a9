package com.kotsin.ledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger summary read back right after a successful write. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteResult {

    private String spreadsheetTitle;
    private LedgerCurrency currency;

    private double avgPrice;
    private double currentPrice;
    private double zoneATarget;
    private double zoneBTarget;
    private double sellTarget;

    /** running total quantity on the written row; 0 when the cell is unreadable */
    private double sellQtyCurrentRound;
}
