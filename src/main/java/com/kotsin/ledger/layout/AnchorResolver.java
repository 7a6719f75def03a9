package com.kotsin.ledger.layout;

import com.kotsin.ledger.grid.Grid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Locates the header row, the date column and the two zone columns inside an
 * arbitrary ledger grid. Pure over the snapshot: the grid is never modified.
 *
 * <p>Two passes, first success wins:
 * <ol>
 *   <li>date-first: for each date label, look for both zone labels in the same row
 *       and the two rows below it, within the 14 columns to its right;</li>
 *   <li>label-first: take the first zone A and first zone B label anywhere, then look
 *       for a date label on the row of either one, or the row directly above or below.</li>
 * </ol>
 * The header row is the lowest row on which one of the three labels was found,
 * since a header may be split over two lines.
 */
@Component
@Slf4j
public class AnchorResolver {

    static final int WINDOW_ROWS_BELOW = 2;
    static final int WINDOW_COLS_RIGHT = 14;
    static final int TOTAL_QTY_FALLBACK_OFFSET = 4;

    public AnchorResolution resolve(Grid grid) {
        if (grid == null || grid.isEmpty()) {
            return AnchorResolution.notFound("sheet is empty");
        }

        AnchorResolution byDate = resolveDateFirst(grid);
        if (byDate.isFound()) {
            return byDate;
        }
        AnchorResolution byLabel = resolveLabelFirst(grid);
        if (byLabel.isFound()) {
            return byLabel;
        }
        return AnchorResolution.notFound("anchor not found (date / LOC평단 / LOC고가 header)");
    }

    /**
     * Column of the running-total quantity, searched on the header row and the rows
     * directly above and below it; {@code zoneBCol + 4} when no label matches.
     */
    public int resolveTotalQtyColumn(Grid grid, Anchor anchor) {
        int header = anchor.headerRow();
        for (int r : new int[]{header, header - 1, header + 1}) {
            if (r < 1 || r > grid.rowCount()) continue;
            for (int c = 1; c <= grid.columnCount(r); c++) {
                if (LabelMatcher.matches(LabelClass.TOTAL_QTY, grid.cell(r, c))) {
                    return c;
                }
            }
        }
        return anchor.zoneBCol() + TOTAL_QTY_FALLBACK_OFFSET;
    }

    private AnchorResolution resolveDateFirst(Grid grid) {
        int rowCount = grid.rowCount();
        int maxCol = grid.maxColumnCount();

        for (int r = 1; r <= rowCount; r++) {
            for (int c = 1; c <= grid.columnCount(r); c++) {
                if (!LabelMatcher.matches(LabelClass.DATE, grid.cell(r, c))) continue;

                int zoneACol = 0, zoneARow = r;
                int zoneBCol = 0, zoneBRow = r;
                int lastRow = Math.min(r + WINDOW_ROWS_BELOW, rowCount);
                int lastCol = Math.min(c + WINDOW_COLS_RIGHT, maxCol);

                for (int rr = r; rr <= lastRow; rr++) {
                    for (int cc = c + 1; cc <= lastCol; cc++) {
                        String cell = grid.cell(rr, cc);
                        if (zoneACol == 0 && LabelMatcher.matches(LabelClass.ZONE_A, cell)) {
                            zoneACol = cc;
                            zoneARow = rr;
                        }
                        if (zoneBCol == 0 && LabelMatcher.matches(LabelClass.ZONE_B, cell)) {
                            zoneBCol = cc;
                            zoneBRow = rr;
                        }
                    }
                    if (zoneACol != 0 && zoneBCol != 0) break;
                }

                if (zoneACol == 0 || zoneBCol == 0) continue;
                if (zoneACol == zoneBCol) {
                    log.debug("anchor_candidate_rejected date=({},{}) zone_col={} reason=same_column", r, c, zoneACol);
                    continue;
                }
                int headerRow = Math.max(r, Math.max(zoneARow, zoneBRow));
                return AnchorResolution.found(new Anchor(headerRow, c, zoneACol, zoneBCol));
            }
        }
        return AnchorResolution.notFound("no date label with both zone labels nearby");
    }

    private AnchorResolution resolveLabelFirst(Grid grid) {
        int rowCount = grid.rowCount();
        int zoneACol = 0, zoneARow = 0;
        int zoneBCol = 0, zoneBRow = 0;

        for (int r = 1; r <= rowCount && (zoneACol == 0 || zoneBCol == 0); r++) {
            for (int c = 1; c <= grid.columnCount(r); c++) {
                String cell = grid.cell(r, c);
                if (zoneACol == 0 && LabelMatcher.matches(LabelClass.ZONE_A, cell)) {
                    zoneACol = c;
                    zoneARow = r;
                }
                if (zoneBCol == 0 && LabelMatcher.matches(LabelClass.ZONE_B, cell)) {
                    zoneBCol = c;
                    zoneBRow = r;
                }
            }
        }

        if (zoneACol == 0 || zoneBCol == 0) {
            return AnchorResolution.notFound("zone labels not found");
        }
        if (zoneACol == zoneBCol) {
            return AnchorResolution.notFound("zone labels share column " + zoneACol);
        }

        for (int base : new int[]{zoneARow, zoneBRow}) {
            for (int rr : new int[]{base, base - 1, base + 1}) {
                if (rr < 1 || rr > rowCount) continue;
                for (int c = 1; c <= grid.columnCount(rr); c++) {
                    if (LabelMatcher.matches(LabelClass.DATE, grid.cell(rr, c))) {
                        int headerRow = Math.max(rr, Math.max(zoneARow, zoneBRow));
                        return AnchorResolution.found(new Anchor(headerRow, c, zoneACol, zoneBCol));
                    }
                }
            }
        }
        return AnchorResolution.notFound("no date label next to the zone header");
    }
}
