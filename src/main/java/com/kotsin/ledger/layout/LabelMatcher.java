package com.kotsin.ledger.layout;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fuzzy header-label matching. Normalisation trims, lower-cases and removes all
 * whitespace (punctuation is kept), so "LOC  평단" and "loc평단" are the same label.
 * Heuristic: an ambiguous sheet can match the wrong cell.
 */
public final class LabelMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LabelMatcher() {
    }

    public static String normalize(String text) {
        if (text == null) return "";
        String s = text.strip().toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(s).replaceAll("");
    }

    public static boolean matches(LabelClass labelClass, String text) {
        String n = normalize(text);
        return !n.isEmpty() && labelClass.accepts(n);
    }
}
