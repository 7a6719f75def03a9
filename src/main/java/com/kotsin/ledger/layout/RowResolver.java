package com.kotsin.ledger.layout;

import com.kotsin.ledger.grid.CellRef;
import com.kotsin.ledger.grid.Grid;
import com.kotsin.ledger.grid.GridStore;
import com.kotsin.ledger.grid.SheetRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Finds the ledger row for a calendar date, appending one when the date is not there yet.
 *
 * <p>The lookup runs on the snapshot. Creation re-reads the live store one date cell
 * at a time from the row under the header and claims the first blank one by writing
 * the date into it. Two writers racing on the same ledger can both claim a row.
 */
@Component
@Slf4j
public class RowResolver {

    public int findOrCreateDateRow(GridStore store, SheetRef sheet, Grid snapshot, Anchor anchor, LocalDate targetDate) {
        int dateCol = anchor.dateCol();

        for (int r = anchor.headerRow() + 1; r <= snapshot.rowCount(); r++) {
            LocalDate parsed = DateCells.parse(snapshot.cell(r, dateCol)).orElse(null);
            if (targetDate.equals(parsed)) {
                return r;
            }
        }

        int r = anchor.headerRow() + 1;
        while (true) {
            CellRef cell = new CellRef(r, dateCol);
            String raw = store.getCellText(sheet, cell);
            if (raw == null || raw.isBlank()) {
                store.updateCell(sheet, cell, DateCells.format(targetDate));
                log.info("date_row_created sheet={} row={} date={}", sheet.spreadsheetTitle(), r, targetDate);
                return r;
            }
            r++;
        }
    }
}
