package com.kotsin.ledger.layout;

/**
 * Resolved header coordinates of a ledger (1-based). Each zone owns the
 * column pair (price, price + 1).
 */
public record Anchor(int headerRow, int dateCol, int zoneACol, int zoneBCol) {

    public Anchor {
        if (zoneACol == zoneBCol) {
            throw new IllegalArgumentException("zone columns must differ, both are " + zoneACol);
        }
    }

    public int zoneAQtyCol() {
        return zoneACol + 1;
    }

    public int zoneBQtyCol() {
        return zoneBCol + 1;
    }
}
