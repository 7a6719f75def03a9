package com.kotsin.ledger.exchange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One closed order as returned by the exchange order-history endpoint.
 * Numeric fields arrive as decimal strings and may be null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpbitOrder {

    private String uuid;
    private String side;          // "bid" | "ask"
    @JsonProperty("ord_type")
    private String ordType;       // "limit" | "price" (market buy) | "market" (market sell) ...
    private String price;         // unit price, or total spend for ord_type=price
    private String state;
    private String market;        // e.g. "KRW-BTC"
    @JsonProperty("created_at")
    private String createdAt;
    @JsonProperty("done_at")
    private String doneAt;
    @JsonProperty("executed_volume")
    private String executedVolume;
    @JsonProperty("executed_funds")
    private String executedFunds;
}
