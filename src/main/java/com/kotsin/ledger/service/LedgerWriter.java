package com.kotsin.ledger.service;

import com.kotsin.ledger.config.LedgerProps;
import com.kotsin.ledger.error.FillParseException;
import com.kotsin.ledger.error.TransportException;
import com.kotsin.ledger.grid.CellRef;
import com.kotsin.ledger.grid.Grid;
import com.kotsin.ledger.grid.GridStore;
import com.kotsin.ledger.grid.SheetRef;
import com.kotsin.ledger.layout.Anchor;
import com.kotsin.ledger.layout.AnchorResolver;
import com.kotsin.ledger.layout.LedgerNumbers;
import com.kotsin.ledger.layout.RowResolver;
import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.LedgerCurrency;
import com.kotsin.ledger.model.WriteResult;
import com.kotsin.ledger.zone.Zone;
import com.kotsin.ledger.zone.ZoneClassifier;
import com.kotsin.ledger.zone.ZonePlan;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Applies one fill to one ledger: snapshot, anchor, reference values, zone, date row,
 * cell writes, summary read-back. Layout is re-resolved on every call so manual edits
 * to the ledger between runs are picked up.
 */
@Service
@Slf4j
public class LedgerWriter {

    private final GridStore gridStore;
    private final SpreadsheetLocator locator;
    private final SpreadsheetBackupService backups;
    private final AnchorResolver anchorResolver;
    private final RowResolver rowResolver;
    private final ZoneClassifier zoneClassifier;
    private final LedgerProps.Cells cells;

    private final Counter fillsWritten;
    private final Counter fillsSkipped;

    public LedgerWriter(GridStore gridStore,
                        SpreadsheetLocator locator,
                        SpreadsheetBackupService backups,
                        AnchorResolver anchorResolver,
                        RowResolver rowResolver,
                        ZoneClassifier zoneClassifier,
                        LedgerProps props,
                        MeterRegistry registry) {
        this.gridStore = gridStore;
        this.locator = locator;
        this.backups = backups;
        this.anchorResolver = anchorResolver;
        this.rowResolver = rowResolver;
        this.zoneClassifier = zoneClassifier;
        this.cells = props.cells();
        this.fillsWritten = registry.counter("ledger.fills.written");
        this.fillsSkipped = registry.counter("ledger.fills.skipped");
    }

    /**
     * Brokerage fill: full quantity into the zone picked by price vs. the ledger average.
     *
     * @return the summary read-back, or empty when the fill is not a buy
     */
    public Optional<WriteResult> applyBrokerageFill(FillEvent fill, String backupContext) {
        if (!fill.isBuy() || fill.getQty() < 0) {
            log.info("fill_ignored symbol={} side={} qty={}", fill.getSymbol(), fill.getSide(), fill.getQty());
            fillsSkipped.increment();
            return Optional.empty();
        }

        SheetRef sheet = locator.locate(fill.getSymbol());
        backups.ensureBackupOnce(sheet, backupContext, fill.getSymbol());
        Grid grid = gridStore.getAllCells(sheet);
        Anchor anchor = anchorResolver.resolve(grid).orElseThrow();
        int totalQtyCol = anchorResolver.resolveTotalQtyColumn(grid, anchor);

        double avgPrice = readNumber(sheet, CellRef.parseA1(cells.avgPrice()));
        Zone zone = zoneClassifier.classify(fill.getPrice(), avgPrice);

        int row = rowResolver.findOrCreateDateRow(gridStore, sheet, grid, anchor, fill.getTradeDate());
        log.info("sheet_write symbol={} row={} zone={} price_col={} qty_col={}",
                fill.getSymbol(), row, zone.label(),
                CellRef.columnLetters(zone.priceCol(anchor)), CellRef.columnLetters(zone.qtyCol(anchor)));

        writePair(sheet, anchor, row, new ZonePlan.ZoneWrite(zone, fill.getPrice(), fill.getQty()));
        fillsWritten.increment();
        return Optional.of(readBack(sheet, row, totalQtyCol, fill.getSymbol()));
    }

    /**
     * Exchange fill: classified by spend amount against the ledger's half-unit amount.
     *
     * @return the summary read-back, or empty when the fill is skipped
     */
    public Optional<WriteResult> applyExchangeFill(FillEvent fill, String sheetSymbol, String backupContext) {
        if (!fill.isBuy()) {
            fillsSkipped.increment();
            return Optional.empty();
        }

        SheetRef sheet = locator.locate(sheetSymbol);
        backups.ensureBackupOnce(sheet, backupContext, sheetSymbol);
        Grid grid = gridStore.getAllCells(sheet);
        Anchor anchor = anchorResolver.resolve(grid).orElseThrow();
        int totalQtyCol = anchorResolver.resolveTotalQtyColumn(grid, anchor);

        double halfUnitAmount = readNumber(sheet, CellRef.parseA1(cells.halfUnitAmount()));
        double avgPrice = readNumber(sheet, CellRef.parseA1(cells.avgPrice()));
        ZonePlan plan = zoneClassifier.classifyByAmount(
                fill.getPrice(), fill.getQty(), fill.getAmount(), halfUnitAmount, avgPrice);
        log.info("upbit_ratio_check fill_id={} amount={} half_unit={} ratio_half={} ratio_full={}",
                fill.getIdempotencyKey(), fill.getAmount(), halfUnitAmount, plan.ratioHalf(), plan.ratioFull());

        if (plan.isSkip()) {
            log.info("upbit_fill_skipped fill_id={} amount={} ratio_half={} ratio_full={}",
                    fill.getIdempotencyKey(), fill.getAmount(), plan.ratioHalf(), plan.ratioFull());
            fillsSkipped.increment();
            return Optional.empty();
        }

        int row = rowResolver.findOrCreateDateRow(gridStore, sheet, grid, anchor, fill.getTradeDate());
        for (ZonePlan.ZoneWrite write : plan.writes()) {
            log.info("upbit_sheet_write mode={} row={} zone={} price={} qty={}",
                    plan.mode().name().toLowerCase(Locale.ROOT), row, write.zone().label(), write.price(), write.qty());
            writePair(sheet, anchor, row, write);
        }
        fillsWritten.increment();
        return Optional.of(readBack(sheet, row, totalQtyCol, sheetSymbol));
    }

    private void writePair(SheetRef sheet, Anchor anchor, int row, ZonePlan.ZoneWrite write) {
        gridStore.updateCell(sheet, new CellRef(row, write.zone().priceCol(anchor)), write.price());
        gridStore.updateCell(sheet, new CellRef(row, write.zone().qtyCol(anchor)), write.qty());
    }

    private WriteResult readBack(SheetRef sheet, int row, int totalQtyCol, String symbolHint) {
        LedgerCurrency currency = symbolHint != null && !symbolHint.isBlank()
                ? LedgerCurrency.fromSymbol(symbolHint)
                : LedgerCurrency.fromSpreadsheetTitle(sheet.spreadsheetTitle());

        double sellQty;
        CellRef totalQtyCell = new CellRef(row, totalQtyCol);
        try {
            sellQty = readNumber(sheet, totalQtyCell);
        } catch (FillParseException | TransportException e) {
            log.debug("total_qty_unreadable cell={} reason={}", totalQtyCell, e.getMessage());
            sellQty = 0.0;
        }

        return WriteResult.builder()
                .spreadsheetTitle(sheet.spreadsheetTitle())
                .currency(currency)
                .avgPrice(readNumber(sheet, CellRef.parseA1(cells.avgPrice())))
                .currentPrice(readNumber(sheet, CellRef.parseA1(cells.currentPrice())))
                .zoneATarget(readNumber(sheet, CellRef.parseA1(cells.zoneATarget())))
                .zoneBTarget(readNumber(sheet, CellRef.parseA1(cells.zoneBTarget())))
                .sellTarget(readNumber(sheet, CellRef.parseA1(cells.sellTarget())))
                .sellQtyCurrentRound(sellQty)
                .build();
    }

    private double readNumber(SheetRef sheet, CellRef cell) {
        return LedgerNumbers.fromCell(gridStore.getComputedValue(sheet, cell), cell.toA1());
    }
}
