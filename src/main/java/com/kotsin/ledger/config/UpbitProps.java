package com.kotsin.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "upbit")
public record UpbitProps(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("") String accessKey,
        @DefaultValue("") String secretKey,
        @DefaultValue("KRW-BTC") String market,
        @DefaultValue("BTC") String marketAsset,
        @DefaultValue("BTC") String sheetSymbol,
        @DefaultValue("https://api.upbit.com") String baseUrl,
        @DefaultValue("/v1/orders/closed") String ordersPath,
        @DefaultValue("30") int maxPages,
        @DefaultValue("업비트 기록 수행") String commandText
) {

    public boolean hasKeys() {
        return accessKey != null && !accessKey.isBlank()
                && secretKey != null && !secretKey.isBlank();
    }
}
