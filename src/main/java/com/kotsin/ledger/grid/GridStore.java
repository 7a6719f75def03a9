package com.kotsin.ledger.grid;

import com.kotsin.ledger.error.TransportException;

/**
 * Remote tabular ledger, seen as a grid-valued cell store. Every method is a
 * single blocking remote call; failures surface as {@link TransportException}.
 */
public interface GridStore {

    SpreadsheetInfo describe(String spreadsheetId) throws TransportException;

    /** consistent snapshot of the formatted cell text at call time */
    Grid getAllCells(SheetRef sheet) throws TransportException;

    /** formatted text of one cell, "" when empty */
    String getCellText(SheetRef sheet, CellRef cell) throws TransportException;

    /**
     * Computed value of one cell: a {@link Number}, a {@link String} or null.
     */
    Object getComputedValue(SheetRef sheet, CellRef cell) throws TransportException;

    void updateCell(SheetRef sheet, CellRef cell, Object value) throws TransportException;
}
