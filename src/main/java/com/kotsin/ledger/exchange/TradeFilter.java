package com.kotsin.ledger.exchange;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Which raw trades a reconciliation keeps.
 *
 * @param targetDate  calendar day, in {@code zone}, that either trade timestamp must fall on
 * @param zone        ledger time zone
 * @param market      market code, e.g. "KRW-BTC"; only consulted when {@code marketAsset} is blank
 * @param marketAsset base asset, e.g. "BTC"
 */
public record TradeFilter(LocalDate targetDate, ZoneId zone, String market, String marketAsset) {
}
