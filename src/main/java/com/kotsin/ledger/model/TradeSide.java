package com.kotsin.ledger.model;

public enum TradeSide {
    BUY,
    SELL;

    /**
     * Maps the brokerage notification wording ("매수" / "매도").
     */
    public static TradeSide fromBrokerage(String text) {
        String t = text == null ? "" : text.trim();
        if ("매수".equals(t)) return BUY;
        if ("매도".equals(t)) return SELL;
        return null;
    }

    /**
     * Maps the exchange order side ("bid" / "ask").
     */
    public static TradeSide fromExchange(String side) {
        if ("bid".equals(side)) return BUY;
        if ("ask".equals(side)) return SELL;
        return null;
    }
}
