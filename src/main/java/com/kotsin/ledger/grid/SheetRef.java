package com.kotsin.ledger.grid;

/**
 * A resolved worksheet inside a spreadsheet.
 *
 * @param spreadsheetId    remote document id
 * @param spreadsheetTitle document title, used for replies and backup file names
 * @param worksheetName    worksheet (tab) title
 */
public record SheetRef(String spreadsheetId, String spreadsheetTitle, String worksheetName) {

    /** range expression for the whole worksheet, or one cell of it */
    public String range(CellRef cell) {
        String quoted = "'" + worksheetName.replace("'", "''") + "'";
        return cell == null ? quoted : quoted + "!" + cell.toA1();
    }
}
