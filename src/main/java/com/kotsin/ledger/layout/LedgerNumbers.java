package com.kotsin.ledger.layout;

import com.kotsin.ledger.error.FillParseException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric extraction from loosely formatted text ("$1,234.50", "12주", "-3.5%").
 */
public final class LedgerNumbers {

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(?:\\.\\d+)?");

    private LedgerNumbers() {
    }

    /**
     * Strips thousands separators and returns the first signed decimal number.
     *
     * @throws FillParseException when the text holds no number
     */
    public static double parse(String text) {
        String s = text == null ? "" : text.replace(",", "");
        Matcher m = NUMBER.matcher(s);
        if (!m.find()) {
            throw new FillParseException("number not found: " + text);
        }
        return Double.parseDouble(m.group());
    }

    /**
     * Interprets a computed cell value. A string that still starts with '=' means the
     * store returned the formula instead of its value, which is rejected.
     */
    public static double fromCell(Object raw, String a1) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            String t = s.strip();
            if (t.startsWith("=")) {
                throw new FillParseException(a1 + " returned a formula instead of a value: " + t);
            }
            return parse(t);
        }
        throw new FillParseException(a1 + " has no numeric value: " + raw);
    }
}
