package com.kotsin.ledger.model;

import java.util.Locale;

public enum LedgerCurrency {
    KRW("₩"),
    USD("$");

    private final String sign;

    LedgerCurrency(String sign) {
        this.sign = sign;
    }

    public String format(double value) {
        return sign + String.format(Locale.US, "%,.2f", value);
    }

    public static LedgerCurrency fromSymbol(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        return "BTC".equals(s) ? KRW : USD;
    }

    public static LedgerCurrency fromSpreadsheetTitle(String title) {
        String t = title == null ? "" : title.toUpperCase(Locale.ROOT);
        if (t.contains("TQQQ")) return USD;
        if (t.contains("BTC") || t.contains("비트코인")) return KRW;
        return USD;
    }
}
