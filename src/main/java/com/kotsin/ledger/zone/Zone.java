package com.kotsin.ledger.zone;

import com.kotsin.ledger.layout.Anchor;

public enum Zone {
    ZONE_A("LOC평단"),
    ZONE_B("LOC고가");

    private final String label;

    Zone(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public int priceCol(Anchor anchor) {
        return this == ZONE_A ? anchor.zoneACol() : anchor.zoneBCol();
    }

    public int qtyCol(Anchor anchor) {
        return priceCol(anchor) + 1;
    }
}
