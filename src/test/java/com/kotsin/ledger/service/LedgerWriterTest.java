package com.kotsin.ledger.service;

import com.kotsin.ledger.config.LedgerProps;
import com.kotsin.ledger.error.LayoutException;
import com.kotsin.ledger.grid.GoogleDriveClient;
import com.kotsin.ledger.grid.InMemoryGridStore;
import com.kotsin.ledger.layout.AnchorResolver;
import com.kotsin.ledger.layout.RowResolver;
import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.FillSource;
import com.kotsin.ledger.model.LedgerCurrency;
import com.kotsin.ledger.model.TradeSide;
import com.kotsin.ledger.model.WriteResult;
import com.kotsin.ledger.zone.ZoneClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end writes against an in-memory ledger laid out like the real ones:
 * header on row 5 (날짜 B, LOC평단 D/E, LOC고가 F/G, 총수량 L), summary cells at fixed addresses.
 */
class LedgerWriterTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SpreadsheetBackupService backups = mock(SpreadsheetBackupService.class);

    private static LedgerProps props() {
        return new LedgerProps("Asia/Seoul", "", "TQQQ:tq-id,BTC:btc-id", false, "state.json",
                false, "backups", new LedgerProps.Cells("R6", "B2", "R9", "R10", "R11", "B3"));
    }

    private LedgerWriter writer(InMemoryGridStore store) {
        SpreadsheetLocator locator = new SpreadsheetLocator(store, mock(GoogleDriveClient.class), props());
        return new LedgerWriter(store, locator, backups, new AnchorResolver(), new RowResolver(),
                new ZoneClassifier(), props(), registry);
    }

    private static InMemoryGridStore ledger(String title) {
        return new InMemoryGridStore(title, "매매기록")
                .withRow(1, title)
                .withRow(5, "", "날짜", "", "LOC평단", "", "LOC고가", "", "", "", "", "", "총수량")
                .withRow(6, "", "2024-03-13", "", "60.1", "5", "", "", "", "", "", "", "5");
    }

    private static FillEvent brokerageBuy(double price, double qty) {
        return FillEvent.builder()
                .source(FillSource.BROKERAGE).symbol("TQQQ").side(TradeSide.BUY)
                .price(price).qty(qty)
                .eventTime(LocalDate.of(2024, 3, 14).atStartOfDay(SEOUL))
                .idempotencyKey("k1")
                .build();
    }

    private static FillEvent exchangeBuy(String id, double price, double qty, double amount) {
        return FillEvent.builder()
                .source(FillSource.EXCHANGE).symbol("BTC").market("KRW-BTC").side(TradeSide.BUY)
                .price(price).qty(qty).amount(amount)
                .eventTime(LocalDate.of(2024, 3, 14).atTime(10, 0).atZone(SEOUL))
                .idempotencyKey(id)
                .build();
    }

    private static List<String> writtenCells(InMemoryGridStore store) {
        return store.writes().stream().map(w -> w.cell().toA1()).toList();
    }

    // ======================== BROKERAGE ========================

    @Test
    @DisplayName("Buy above the average goes to LOC고가 on a new date row and reads back the summary")
    void testBrokerageZoneB() {
        InMemoryGridStore store = ledger("TQQQ 무한매수")
                .withComputed("R6", 60.5).withComputed("B2", "$61.00")
                .withComputed("R9", 60.5).withComputed("R10", 66.55).withComputed("R11", 66.0)
                .withComputed("L7", 17);

        WriteResult result = writer(store).applyBrokerageFill(brokerageBuy(61.23, 12), "meritz_update_1").orElseThrow();

        assertEquals(List.of("B7", "F7", "G7"), writtenCells(store));
        assertEquals("2024-03-14", store.text(7, 2));
        assertEquals(61.23, store.writes().get(1).value());
        assertEquals(12.0, store.writes().get(2).value());

        assertEquals("TQQQ 무한매수", result.getSpreadsheetTitle());
        assertEquals(LedgerCurrency.USD, result.getCurrency());
        assertEquals(60.5, result.getAvgPrice());
        assertEquals(61.0, result.getCurrentPrice());
        assertEquals(66.55, result.getZoneBTarget());
        assertEquals(17.0, result.getSellQtyCurrentRound());
        assertEquals(1.0, registry.counter("ledger.fills.written").count());
        verify(backups).ensureBackupOnce(any(), eq("meritz_update_1"), eq("TQQQ"));
    }

    @Test
    @DisplayName("Buy at the average goes to LOC평단 on the existing date row")
    void testBrokerageZoneAExistingRow() {
        InMemoryGridStore store = ledger("TQQQ 무한매수")
                .withComputed("R6", 61.23).withComputed("B2", 61).withComputed("R9", 1)
                .withComputed("R10", 1).withComputed("R11", 1);
        FillEvent fill = brokerageBuy(61.23, 3);
        fill.setEventTime(LocalDate.of(2024, 3, 13).atStartOfDay(SEOUL));

        WriteResult result = writer(store).applyBrokerageFill(fill, "ctx").orElseThrow();

        assertEquals(List.of("D6", "E6"), writtenCells(store));
        // 총수량 on row 6 holds the text "5"
        assertEquals(5.0, result.getSellQtyCurrentRound());
    }

    @Test
    @DisplayName("Sell notifications are not written")
    void testBrokerageSellIgnored() {
        InMemoryGridStore store = ledger("TQQQ 무한매수");
        FillEvent sell = brokerageBuy(61.23, 12);
        sell.setSide(TradeSide.SELL);

        assertEquals(Optional.empty(), writer(store).applyBrokerageFill(sell, "ctx"));
        assertTrue(store.writes().isEmpty());
        assertEquals(1.0, registry.counter("ledger.fills.skipped").count());
        verifyNoInteractions(backups);
    }

    @Test
    @DisplayName("Unusable average price leaves the ledger untouched")
    void testBrokerageBadAverage() {
        InMemoryGridStore store = ledger("TQQQ 무한매수").withComputed("R6", 0);

        assertThrows(IllegalArgumentException.class,
                () -> writer(store).applyBrokerageFill(brokerageBuy(61.23, 12), "ctx"));
        assertTrue(store.writes().isEmpty());
    }

    @Test
    @DisplayName("Ledger without a recognisable header fails with a layout error")
    void testNoAnchor() {
        InMemoryGridStore store = new InMemoryGridStore("TQQQ 무한매수")
                .withRow(1, "메모")
                .withComputed("R6", 60);

        assertThrows(LayoutException.class,
                () -> writer(store).applyBrokerageFill(brokerageBuy(61.23, 12), "ctx"));
        assertTrue(store.writes().isEmpty());
    }

    @Test
    @DisplayName("Unreadable running total reads back as zero")
    void testTotalQtyUnreadable() {
        InMemoryGridStore store = ledger("TQQQ 무한매수")
                .withComputed("R6", 60.5).withComputed("B2", 61).withComputed("R9", 1)
                .withComputed("R10", 1).withComputed("R11", 1)
                .withComputed("L7", "=SUM(E7,G7)");

        WriteResult result = writer(store).applyBrokerageFill(brokerageBuy(61.23, 12), "ctx").orElseThrow();

        assertEquals(0.0, result.getSellQtyCurrentRound());
    }

    // ======================== EXCHANGE ========================

    private static InMemoryGridStore btcLedger() {
        return ledger("BTC 무한매수")
                .withComputed("B3", 100_000).withComputed("R6", 50_000_000)
                .withComputed("B2", 51_000_000).withComputed("R9", 50_000_000)
                .withComputed("R10", 55_000_000).withComputed("R11", 55_000_000);
    }

    @Test
    @DisplayName("Spend of about two half-units splits the quantity over both zones")
    void testExchangeDual() {
        InMemoryGridStore store = btcLedger();

        WriteResult result = writer(store)
                .applyExchangeFill(exchangeBuy("u1", 50_000_000, 0.004, 200_000), "BTC", "upbit_ctx")
                .orElseThrow();

        assertEquals(List.of("B7", "D7", "E7", "F7", "G7"), writtenCells(store));
        assertEquals(0.002, store.writes().get(2).value());
        assertEquals(0.002, store.writes().get(4).value());
        assertEquals(LedgerCurrency.KRW, result.getCurrency());
        verify(backups).ensureBackupOnce(any(), eq("upbit_ctx"), eq("BTC"));
    }

    @Test
    @DisplayName("Spend of about one half-unit is written once, classified by price")
    void testExchangeSingle() {
        InMemoryGridStore store = btcLedger();

        writer(store).applyExchangeFill(exchangeBuy("u2", 49_000_000, 0.002, 98_000), "BTC", "ctx");

        assertEquals(List.of("B7", "D7", "E7"), writtenCells(store));
        assertEquals(0.002, store.writes().get(2).value());
    }

    @Test
    @DisplayName("Spend outside both bands is skipped without creating a row")
    void testExchangeSkip() {
        InMemoryGridStore store = btcLedger();

        Optional<WriteResult> result = writer(store)
                .applyExchangeFill(exchangeBuy("u3", 50_000_000, 0.001, 50_000), "BTC", "ctx");

        assertTrue(result.isEmpty());
        assertTrue(store.writes().isEmpty());
        assertEquals(1.0, registry.counter("ledger.fills.skipped").count());
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    @DisplayName("Skip decision is logged with the raw spend ratios")
    void testExchangeSkipLogged(CapturedOutput output) {
        writer(btcLedger()).applyExchangeFill(exchangeBuy("u4", 50_000_000, 0.001, 50_000), "BTC", "ctx");

        assertTrue(output.getOut().contains(
                "upbit_ratio_check fill_id=u4 amount=50000.0 half_unit=100000.0 ratio_half=0.5 ratio_full=0.25"));
        assertTrue(output.getOut().contains(
                "upbit_fill_skipped fill_id=u4 amount=50000.0 ratio_half=0.5 ratio_full=0.25"));
    }

    @Test
    @DisplayName("Unknown symbol without title lookup is a configuration error")
    void testUnknownSymbol() {
        InMemoryGridStore store = btcLedger();
        FillEvent fill = brokerageBuy(10, 1);
        fill.setSymbol("SOXL");

        assertThrows(IllegalStateException.class, () -> writer(store).applyBrokerageFill(fill, "ctx"));
    }
}
