package com.kotsin.ledger.exchange;

import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.FillSource;
import com.kotsin.ledger.state.SeenSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FillReconcilerTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 14);
    private static final TradeFilter FILTER = new TradeFilter(DAY, SEOUL, "KRW-BTC", "BTC");

    private final FillReconciler reconciler = new FillReconciler();

    private static UpbitOrder limitBuy(String uuid, String doneAt, String price, String volume, String funds) {
        return UpbitOrder.builder()
                .uuid(uuid).side("bid").ordType("limit").market("KRW-BTC").state("done")
                .price(price).executedVolume(volume).executedFunds(funds)
                .createdAt(doneAt).doneAt(doneAt)
                .build();
    }

    @Test
    @DisplayName("Second pass without a pinned date forwards nothing already seen")
    void testDedupAcrossCalls() {
        List<UpbitOrder> first = List.of(
                limitBuy("u1", "2024-03-14T10:00:00+09:00", "50000000", "0.002", "100000"),
                limitBuy("u2", "2024-03-14T11:00:00+09:00", "51000000", "0.002", "102000"));
        List<UpbitOrder> second = new ArrayList<>(first);
        second.add(limitBuy("u3", "2024-03-14T12:00:00+09:00", "52000000", "0.002", "104000"));

        ReconcileResult r1 = reconciler.reconcile(first, SeenSet.empty(), false, FILTER);
        ReconcileResult r2 = reconciler.reconcile(second, r1.updatedSeen(), false, FILTER);

        assertEquals(List.of("u1", "u2"), keys(r1.newEvents()));
        assertEquals(List.of("u3"), keys(r2.newEvents()));
        assertEquals(2, r2.stats().skipSeen());
        assertTrue(r2.updatedSeen().contains("u1"));
        assertTrue(r2.updatedSeen().contains("u3"));
    }

    @Test
    @DisplayName("Pinned date replays fills that were already seen")
    void testExplicitReplay() {
        List<UpbitOrder> raw = List.of(limitBuy("u1", "2024-03-14T10:00:00+09:00", "50000000", "0.002", "100000"));
        SeenSet seen = SeenSet.of(List.of("u1"));

        ReconcileResult result = reconciler.reconcile(raw, seen, true, FILTER);

        assertEquals(List.of("u1"), keys(result.newEvents()));
        assertEquals(0, result.stats().skipSeen());
    }

    @Test
    @DisplayName("Market buy reports total spend; unit price is derived from it")
    void testMarketBuyPrice() {
        UpbitOrder market = UpbitOrder.builder()
                .uuid("m1").side("bid").ordType("price").market("KRW-BTC")
                .price("200000").executedVolume("0.004").executedFunds("199990")
                .doneAt("2024-03-14T09:15:00+09:00")
                .build();

        FillEvent fill = reconciler.reconcile(List.of(market), SeenSet.empty(), false, FILTER).newEvents().get(0);

        assertEquals(200000, fill.getAmount(), 1e-9);
        assertEquals(50_000_000, fill.getPrice(), 1e-6);
        assertEquals(0.004, fill.getQty(), 1e-12);
        assertEquals(FillSource.EXCHANGE, fill.getSource());
        assertEquals("BTC", fill.getSymbol());
        assertEquals("KRW-BTC", fill.getMarket());
    }

    @Test
    @DisplayName("Limit buy amount falls back to price times quantity without executed funds")
    void testAmountFallback() {
        UpbitOrder noFunds = limitBuy("l1", "2024-03-14T09:00:00+09:00", "50000000", "0.002", null);

        FillEvent fill = reconciler.reconcile(List.of(noFunds), SeenSet.empty(), false, FILTER).newEvents().get(0);

        assertEquals(100000, fill.getAmount(), 1e-6);
        assertEquals(50_000_000, fill.getPrice(), 1e-9);
    }

    @Test
    @DisplayName("A trade counts when either timestamp falls on the target day in the ledger zone")
    void testDateFilter() {
        // created late on the 13th (Seoul), done on the 14th
        UpbitOrder doneOnDay = UpbitOrder.builder()
                .uuid("a").side("bid").ordType("limit").market("KRW-BTC")
                .price("100").executedVolume("1").executedFunds("100")
                .createdAt("2024-03-13T23:50:00+09:00").doneAt("2024-03-14T00:10:00+09:00").build();
        // created on the 14th, done on the 15th
        UpbitOrder createdOnDay = UpbitOrder.builder()
                .uuid("b").side("bid").ordType("limit").market("KRW-BTC")
                .price("100").executedVolume("1").executedFunds("100")
                .createdAt("2024-03-14T23:50:00+09:00").doneAt("2024-03-15T00:10:00+09:00").build();
        // UTC timestamp that is the 15th in Seoul
        UpbitOrder nextDayInSeoul = limitBuy("c", "2024-03-14T16:30:00Z", "100", "1", "100");
        UpbitOrder noTimes = UpbitOrder.builder()
                .uuid("d").side("bid").market("KRW-BTC").price("100").executedVolume("1").build();

        ReconcileResult result = reconciler.reconcile(
                List.of(doneOnDay, createdOnDay, nextDayInSeoul, noTimes), SeenSet.empty(), false, FILTER);

        assertEquals(List.of("a", "b"), keys(result.newEvents()));
        assertEquals(2, result.stats().skipDate());
        assertEquals(DAY, result.newEvents().get(0).getTradeDate());
    }

    @Test
    @DisplayName("Other assets, sells and empty executions are filtered out")
    void testFilters() {
        UpbitOrder eth = limitBuy("eth", "2024-03-14T10:00:00+09:00", "5000000", "0.1", "500000");
        eth.setMarket("KRW-ETH");
        UpbitOrder sell = limitBuy("sell", "2024-03-14T10:00:00+09:00", "50000000", "0.002", "100000");
        sell.setSide("ask");
        UpbitOrder cancelled = limitBuy("cx", "2024-03-14T10:00:00+09:00", "50000000", "0", "0");
        UpbitOrder noAmount = limitBuy("na", "2024-03-14T10:00:00+09:00", null, "0.002", null);

        ReconcileResult result = reconciler.reconcile(
                List.of(eth, sell, cancelled, noAmount), SeenSet.empty(), false, FILTER);

        assertTrue(result.newEvents().isEmpty());
        assertEquals(1, result.stats().skipMarket());
        assertEquals(1, result.stats().skipSide());
        assertEquals(1, result.stats().skipQty());
        assertEquals(1, result.stats().skipAmount());
        assertEquals(0, result.updatedSeen().size());
    }

    @Test
    @DisplayName("Fills are returned oldest first")
    void testChronologicalOrder() {
        List<UpbitOrder> newestFirst = List.of(
                limitBuy("z-late", "2024-03-14T15:00:00+09:00", "100", "1", "100"),
                limitBuy("a-mid", "2024-03-14T12:00:00+09:00", "100", "1", "100"),
                limitBuy("m-early", "2024-03-14T08:00:00+09:00", "100", "1", "100"));

        ReconcileResult result = reconciler.reconcile(newestFirst, SeenSet.empty(), false, FILTER);

        assertEquals(List.of("m-early", "a-mid", "z-late"), keys(result.newEvents()));
    }

    @Test
    @DisplayName("Missing identifier falls back to market:time:qty:price, duplicates collapse")
    void testFallbackId() {
        UpbitOrder anon = limitBuy(null, "2024-03-14T10:00:00+09:00", "100", "2", "200");

        ReconcileResult result = reconciler.reconcile(List.of(anon, anon), SeenSet.empty(), false, FILTER);

        assertEquals(1, result.newEvents().size());
        assertEquals("KRW-BTC:2024-03-14T10:00+09:00:2.0:100.0", result.newEvents().get(0).getIdempotencyKey());
    }

    @Test
    @DisplayName("Pages are read until an empty page or the page limit")
    void testCollect() {
        List<Integer> requested = new ArrayList<>();
        TradeHistorySource threePages = page -> {
            requested.add(page);
            return page <= 3 ? List.of(limitBuy("p" + page, "2024-03-14T10:00:00+09:00", "1", "1", "1")) : List.of();
        };

        assertEquals(3, reconciler.collect(threePages, 30).size());
        assertEquals(List.of(1, 2, 3, 4), requested);

        requested.clear();
        assertEquals(2, reconciler.collect(threePages, 2).size());
        assertEquals(List.of(1, 2), requested);
    }

    private static List<String> keys(List<FillEvent> events) {
        return events.stream().map(FillEvent::getIdempotencyKey).toList();
    }
}
