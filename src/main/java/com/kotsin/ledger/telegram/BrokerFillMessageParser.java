package com.kotsin.ledger.telegram;

import com.kotsin.ledger.error.FillParseException;
import com.kotsin.ledger.layout.LedgerNumbers;
import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.FillSource;
import com.kotsin.ledger.model.TradeSide;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the brokerage's overseas-stock fill notification:
 *
 * <pre>
 * [메리츠증권] 해외주식 주문체결 안내
 * 종목명 : ProShares UltraPro QQQ(TQQQ)
 * 매매구분 : 매수
 * 체결단가 : $61.23
 * 체결수량 : 12주
 * 체결일자 : 03/14
 * </pre>
 *
 * The notification carries no year; the current year in the ledger time zone is used.
 */
@Component
public class BrokerFillMessageParser {

    static final String BANNER = "[메리츠증권] 해외주식 주문체결 안내";

    static final String KEY_NAME = "종목명";
    static final String KEY_SIDE = "매매구분";
    static final String KEY_PRICE = "체결단가";
    static final String KEY_QTY = "체결수량";
    static final String KEY_DATE = "체결일자";

    private static final Pattern SYMBOL = Pattern.compile("\\(([^)]+)\\)");
    private static final Pattern MONTH_DAY = Pattern.compile("(\\d{1,2})\\s*/\\s*(\\d{1,2})");

    private final Clock clock;

    public BrokerFillMessageParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the fill, or empty when the text is not a complete fill notification
     * @throws FillParseException when a field is present but malformed
     */
    public Optional<FillEvent> parse(String text) {
        if (text == null || !text.contains(BANNER)) {
            return Optional.empty();
        }
        Map<String, String> kv = keyValues(text);
        String name = kv.getOrDefault(KEY_NAME, "");
        String side = kv.getOrDefault(KEY_SIDE, "");
        String priceRaw = kv.getOrDefault(KEY_PRICE, "");
        String qtyRaw = kv.getOrDefault(KEY_QTY, "");
        String dateRaw = kv.getOrDefault(KEY_DATE, "");
        if (StringUtils.isAnyBlank(name, side, priceRaw, qtyRaw, dateRaw)) {
            return Optional.empty();
        }

        String symbol = symbol(name);
        double price = LedgerNumbers.parse(priceRaw);
        double qty = LedgerNumbers.parse(qtyRaw);
        LocalDate date = fillDate(dateRaw);
        TradeSide tradeSide = TradeSide.fromBrokerage(side);

        return Optional.of(FillEvent.builder()
                .source(FillSource.BROKERAGE)
                .symbol(symbol)
                .side(tradeSide)
                .price(price)
                .qty(qty)
                .eventTime(date.atStartOfDay(clock.getZone()))
                .idempotencyKey(idempotencyKey(symbol, side, date, price, qty))
                .build());
    }

    static Map<String, String> keyValues(String text) {
        Map<String, String> out = new HashMap<>();
        for (String line : text.split("\\R")) {
            String l = line.strip();
            int sep = l.indexOf(':');
            if (l.isEmpty() || sep < 0) continue;
            out.put(l.substring(0, sep).strip(), l.substring(sep + 1).strip());
        }
        return out;
    }

    static String symbol(String stockName) {
        Matcher m = SYMBOL.matcher(stockName);
        if (!m.find()) {
            throw new FillParseException("symbol not found in " + KEY_NAME + ": " + stockName);
        }
        return m.group(1).strip().toUpperCase(Locale.ROOT);
    }

    LocalDate fillDate(String monthDay) {
        Matcher m = MONTH_DAY.matcher(monthDay);
        if (!m.find()) {
            throw new FillParseException("invalid " + KEY_DATE + ": " + monthDay);
        }
        int year = LocalDate.now(clock).getYear();
        try {
            return LocalDate.of(year, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (DateTimeException e) {
            throw new FillParseException("invalid " + KEY_DATE + ": " + monthDay, e);
        }
    }

    /**
     * Deterministic: the same notification delivered twice yields the same key.
     */
    static String idempotencyKey(String symbol, String side, LocalDate date, double price, double qty) {
        String input = String.format(Locale.ROOT, "%s:%s:%s:%.6f:%.6f", symbol, side, date, price, qty);
        return UUID.nameUUIDFromBytes(input.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
