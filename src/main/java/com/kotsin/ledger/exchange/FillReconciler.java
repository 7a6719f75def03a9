package com.kotsin.ledger.exchange;

import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.FillSource;
import com.kotsin.ledger.model.TradeSide;
import com.kotsin.ledger.state.SeenSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw exchange order history into buy fills for one day and one asset,
 * dropping the ones already applied.
 */
@Component
@Slf4j
public class FillReconciler {

    /**
     * Reads pages until an empty page or {@code maxPages}, whichever comes first.
     */
    public List<UpbitOrder> collect(TradeHistorySource source, int maxPages) {
        List<UpbitOrder> out = new ArrayList<>();
        int page = 1;
        while (page <= maxPages) {
            List<UpbitOrder> rows = source.fetchPage(page);
            if (rows == null || rows.isEmpty()) break;
            out.addAll(rows);
            page++;
        }
        log.debug("upbit_pages_read pages={} rows={}", page - 1, out.size());
        return out;
    }

    /**
     * @param explicitTarget when true every matching fill is replayed, seen or not
     */
    public ReconcileResult reconcile(List<UpbitOrder> raw, SeenSet alreadySeen, boolean explicitTarget,
                                     TradeFilter filter) {
        int skipDate = 0, skipMarket = 0, skipSide = 0, skipQty = 0, skipAmount = 0, skipSeen = 0;
        Map<String, FillEvent> byId = new LinkedHashMap<>();
        String asset = upper(filter.marketAsset());
        String marketFilter = filter.market() == null ? "" : filter.market().trim();

        for (UpbitOrder row : raw) {
            ZonedDateTime done = parseTime(row.getDoneAt(), filter);
            ZonedDateTime created = parseTime(row.getCreatedAt(), filter);
            if (done == null && created == null) {
                skipDate++;
                continue;
            }
            LocalDate target = filter.targetDate();
            boolean onTarget = (done != null && done.toLocalDate().equals(target))
                    || (created != null && created.toLocalDate().equals(target));
            if (!onTarget) {
                skipDate++;
                continue;
            }

            String market = row.getMarket() == null ? "" : row.getMarket();
            String baseAsset = upper(market.contains("-") ? market.substring(market.lastIndexOf('-') + 1) : market);
            boolean marketOk = asset.isEmpty()
                    ? marketFilter.isEmpty() || marketFilter.equals(market)
                    : asset.equals(baseAsset);
            if (!marketOk) {
                skipMarket++;
                continue;
            }

            if (TradeSide.fromExchange(row.getSide()) != TradeSide.BUY) {
                skipSide++;
                continue;
            }

            double qty = number(row.getExecutedVolume());
            double executedFunds = number(row.getExecutedFunds());
            double rawPrice = number(row.getPrice());
            if (qty <= 0) {
                skipQty++;
                continue;
            }

            // market buy: "price" is the total spend, not a unit price
            boolean marketBuy = "price".equals(row.getOrdType());
            double amount;
            if (marketBuy && rawPrice > 0) {
                amount = rawPrice;
            } else if (executedFunds > 0) {
                amount = executedFunds;
            } else {
                amount = rawPrice > 0 ? rawPrice * qty : 0.0;
            }
            if (amount <= 0) {
                skipAmount++;
                continue;
            }
            double price = marketBuy || rawPrice <= 0 ? amount / qty : rawPrice;

            ZonedDateTime tradeTime = done != null ? done : created;
            String id = row.getUuid() != null && !row.getUuid().isBlank()
                    ? row.getUuid()
                    : market + ":" + tradeTime.toOffsetDateTime() + ":" + qty + ":" + price;

            if (!explicitTarget && alreadySeen.contains(id)) {
                skipSeen++;
                continue;
            }
            byId.putIfAbsent(id, FillEvent.builder()
                    .source(FillSource.EXCHANGE)
                    .symbol(baseAsset)
                    .market(market)
                    .side(TradeSide.BUY)
                    .price(price)
                    .qty(qty)
                    .amount(amount)
                    .eventTime(tradeTime)
                    .idempotencyKey(id)
                    .build());
        }

        List<FillEvent> events = new ArrayList<>(byId.values());
        events.sort(Comparator.comparing(FillEvent::getEventTime));
        SeenSet updated = alreadySeen.plusAll(byId.keySet());

        ReconcileResult.Stats stats = new ReconcileResult.Stats(raw.size(), events.size(),
                skipDate, skipMarket, skipSide, skipQty, skipAmount, skipSeen);
        log.info("upbit_fetch_done target_date={} market={} asset={} rows={} fills={} skip_date={} "
                        + "skip_market={} skip_side={} skip_qty={} skip_amount={} skip_seen={} explicit={}",
                filter.targetDate(), marketFilter, asset, stats.rows(), stats.fills(), skipDate,
                skipMarket, skipSide, skipQty, skipAmount, skipSeen, explicitTarget);
        return new ReconcileResult(events, updated, stats);
    }

    private static ZonedDateTime parseTime(String text, TradeFilter filter) {
        if (text == null || text.isBlank()) return null;
        try {
            return OffsetDateTime.parse(text.trim()).atZoneSameInstant(filter.zone());
        } catch (DateTimeParseException e) {
            log.warn("upbit_bad_timestamp value={}", text);
            return null;
        }
    }

    private static double number(String text) {
        if (text == null || text.isBlank()) return 0.0;
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.warn("upbit_bad_number value={}", text);
            return 0.0;
        }
    }

    private static String upper(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }
}
