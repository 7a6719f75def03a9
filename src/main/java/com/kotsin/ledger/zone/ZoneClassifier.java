package com.kotsin.ledger.zone;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which zone column pair a fill belongs in. No I/O.
 */
@Component
public class ZoneClassifier {

    static final double BAND_LOW = 0.8;
    static final double BAND_HIGH = 1.2;

    /**
     * Brokerage rule: at or below the reference average price goes to zone A, above it to zone B.
     *
     * @throws IllegalArgumentException when the reference price is not positive
     */
    public Zone classify(double fillPrice, double referenceAvgPrice) {
        if (!(referenceAvgPrice > 0)) {
            throw new IllegalArgumentException("reference average price must be positive: " + referenceAvgPrice);
        }
        return fillPrice <= referenceAvgPrice ? Zone.ZONE_A : Zone.ZONE_B;
    }

    /**
     * Exchange rule. The spend amount is compared to one and two half-unit amounts with a
     * ±20% band: about two units is a dual write (quantity split over both zones), about
     * one unit is a single write classified by price, anything else is skipped.
     */
    public ZonePlan classifyByAmount(double price, double qty, double amount,
                                     double halfUnitAmount, double referenceAvgPrice) {
        double ratioHalf = halfUnitAmount > 0 ? amount / halfUnitAmount : 0;
        double ratioFull = halfUnitAmount > 0 ? amount / (halfUnitAmount * 2) : 0;

        if (inBand(ratioFull)) {
            double halfQty = qty / 2.0;
            return new ZonePlan(ZonePlan.Mode.DUAL, List.of(
                    new ZonePlan.ZoneWrite(Zone.ZONE_A, price, halfQty),
                    new ZonePlan.ZoneWrite(Zone.ZONE_B, price, halfQty)),
                    ratioHalf, ratioFull);
        }
        if (inBand(ratioHalf)) {
            Zone zone;
            try {
                zone = classify(price, referenceAvgPrice);
            } catch (IllegalArgumentException e) {
                return skip(ratioHalf, ratioFull);
            }
            return new ZonePlan(ZonePlan.Mode.SINGLE, List.of(new ZonePlan.ZoneWrite(zone, price, qty)),
                    ratioHalf, ratioFull);
        }
        return skip(ratioHalf, ratioFull);
    }

    private static boolean inBand(double ratio) {
        return ratio >= BAND_LOW && ratio <= BAND_HIGH;
    }

    private static ZonePlan skip(double ratioHalf, double ratioFull) {
        return new ZonePlan(ZonePlan.Mode.SKIP, List.of(), ratioHalf, ratioFull);
    }
}
