package com.kotsin.ledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * One trade execution, from either the brokerage notification feed or the
 * exchange trade history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillEvent {

    private FillSource source;
    private String symbol;
    /** exchange market code, e.g. "KRW-BTC"; null for brokerage fills */
    private String market;
    private TradeSide side;

    private double price;
    private double qty;
    /** total spend; 0 when the source does not report it */
    private double amount;

    /** brokerage fills only carry a calendar day, stored as start of day in the ledger zone */
    private ZonedDateTime eventTime;
    private String idempotencyKey;

    public LocalDate getTradeDate() {
        return eventTime.toLocalDate();
    }

    public boolean isBuy() {
        return side == TradeSide.BUY;
    }
}
