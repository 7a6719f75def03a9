package com.kotsin.ledger.zone;

import java.util.List;

/**
 * What to write for one exchange fill.
 *
 * @param mode       DUAL, SINGLE or SKIP
 * @param writes     price/quantity pairs to write, empty for SKIP
 * @param ratioHalf  amount / half-unit amount
 * @param ratioFull  amount / (2 * half-unit amount)
 */
public record ZonePlan(Mode mode, List<ZoneWrite> writes, double ratioHalf, double ratioFull) {

    public enum Mode { DUAL, SINGLE, SKIP }

    public record ZoneWrite(Zone zone, double price, double qty) {
    }

    public boolean isSkip() {
        return mode == Mode.SKIP;
    }
}
