package com.kotsin.ledger.grid;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 1-based cell coordinate with A1 conversion.
 */
public record CellRef(int row, int col) {

    private static final Pattern A1 = Pattern.compile("^([A-Za-z]+)(\\d+)$");

    public CellRef {
        if (row < 1 || col < 1) {
            throw new IllegalArgumentException("cell coordinates are 1-based: row=" + row + " col=" + col);
        }
    }

    public static CellRef parseA1(String a1) {
        Matcher m = A1.matcher(a1 == null ? "" : a1.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("not an A1 address: " + a1);
        }
        String letters = m.group(1).toUpperCase(Locale.ROOT);
        int col = 0;
        for (char ch : letters.toCharArray()) {
            col = col * 26 + (ch - 'A' + 1);
        }
        return new CellRef(Integer.parseInt(m.group(2)), col);
    }

    public static String columnLetters(int col) {
        StringBuilder sb = new StringBuilder();
        int n = col;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public String toA1() {
        return columnLetters(col) + row;
    }

    @Override
    public String toString() {
        return toA1();
    }
}
