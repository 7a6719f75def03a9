package com.kotsin.ledger.exchange;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.ledger.config.UpbitProps;
import com.kotsin.ledger.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Closed-order history client. Fetches both fully filled ("done") and
 * cancelled-with-executions ("cancel") orders, newest first.
 */
@Service
@Slf4j
public class UpbitApiClient implements TradeHistorySource {

    static final String LEGACY_ORDERS_PATH = "/v1/orders";
    static final int PAGE_LIMIT = 100;

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final UpbitProps props;
    private final UpbitTokenSigner signer;

    public UpbitApiClient(OkHttpClient http, ObjectMapper mapper, UpbitProps props) {
        this.http = http;
        this.mapper = mapper;
        this.props = props;
        this.signer = new UpbitTokenSigner(props.accessKey(), props.secretKey(), mapper);
    }

    @Override
    public List<UpbitOrder> fetchPage(int page) {
        List<Map.Entry<String, String>> params = new ArrayList<>();
        params.add(Map.entry("states[]", "done"));
        params.add(Map.entry("states[]", "cancel"));
        params.add(Map.entry("page", String.valueOf(page)));
        params.add(Map.entry("limit", String.valueOf(PAGE_LIMIT)));
        params.add(Map.entry("order_by", "desc"));

        // the signed hash must cover the un-encoded query exactly as sent
        String query = params.stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        String authorization = signer.authorizationHeader(query);

        try (Response resp = call(props.ordersPath(), params, authorization)) {
            if ((resp.code() == 404 || resp.code() == 405) && !LEGACY_ORDERS_PATH.equals(props.ordersPath())) {
                log.warn("upbit_orders_path_fallback path={} status={}", props.ordersPath(), resp.code());
                try (Response legacy = call(LEGACY_ORDERS_PATH, params, authorization)) {
                    return read(legacy, page);
                }
            }
            return read(resp, page);
        } catch (IOException e) {
            throw new TransportException("Upbit order history page " + page + " error", e);
        }
    }

    private Response call(String path, List<Map.Entry<String, String>> params, String authorization) throws IOException {
        HttpUrl.Builder url = HttpUrl.get(props.baseUrl()).newBuilder().encodedPath(path);
        for (Map.Entry<String, String> p : params) {
            url.addQueryParameter(p.getKey(), p.getValue());
        }
        Request req = new Request.Builder()
                .url(url.build())
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .get()
                .build();
        return http.newCall(req).execute();
    }

    private List<UpbitOrder> read(Response resp, int page) throws IOException {
        if (!resp.isSuccessful() || resp.body() == null) {
            throw new TransportException("Upbit order history page " + page + " failed: HTTP " + resp.code());
        }
        return mapper.readValue(resp.body().byteStream(), new TypeReference<List<UpbitOrder>>() {});
    }
}
