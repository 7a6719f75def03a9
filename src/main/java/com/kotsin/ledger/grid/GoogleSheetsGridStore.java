package com.kotsin.ledger.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kotsin.ledger.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link GridStore} backed by the Google Sheets v4 REST API.
 */
@Service
@Slf4j
public class GoogleSheetsGridStore implements GridStore {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final AccessTokenProvider tokens;
    private final HttpUrl baseUrl;

    public GoogleSheetsGridStore(OkHttpClient http,
                                 ObjectMapper mapper,
                                 AccessTokenProvider tokens,
                                 @Value("${google.sheets.base-url:https://sheets.googleapis.com}") String baseUrl) {
        this.http = http;
        this.mapper = mapper;
        this.tokens = tokens;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    @Override
    public SpreadsheetInfo describe(String spreadsheetId) {
        HttpUrl url = spreadsheetUrl(spreadsheetId)
                .addQueryParameter("fields", "properties.title,sheets.properties.title")
                .build();
        JsonNode json = execute(get(url), "describe " + spreadsheetId);
        List<String> worksheets = new ArrayList<>();
        for (JsonNode sheet : json.path("sheets")) {
            worksheets.add(sheet.path("properties").path("title").asText());
        }
        return new SpreadsheetInfo(spreadsheetId, json.path("properties").path("title").asText(""), worksheets);
    }

    @Override
    public Grid getAllCells(SheetRef sheet) {
        JsonNode json = execute(get(valuesUrl(sheet, null, "FORMATTED_VALUE")), "read " + sheet.range(null));
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode row : json.path("values")) {
            List<String> cells = new ArrayList<>(row.size());
            for (JsonNode cell : row) {
                cells.add(cell.asText(""));
            }
            rows.add(cells);
        }
        return Grid.of(rows);
    }

    @Override
    public String getCellText(SheetRef sheet, CellRef cell) {
        JsonNode value = singleValue(sheet, cell, "FORMATTED_VALUE");
        return value == null ? "" : value.asText("");
    }

    @Override
    public Object getComputedValue(SheetRef sheet, CellRef cell) {
        JsonNode value = singleValue(sheet, cell, "UNFORMATTED_VALUE");
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.asDouble();
        return value.asText();
    }

    @Override
    public void updateCell(SheetRef sheet, CellRef cell, Object value) {
        String range = sheet.range(cell);
        HttpUrl url = valuesUrlBuilder(sheet, cell)
                .addQueryParameter("valueInputOption", "RAW")
                .build();
        ObjectNode body = mapper.createObjectNode();
        body.put("range", range);
        body.put("majorDimension", "ROWS");
        body.putArray("values").addArray().addPOJO(value);
        try {
            Request req = authorized(url)
                    .put(RequestBody.create(mapper.writeValueAsString(body), JSON))
                    .build();
            execute(req, "update " + range);
        } catch (IOException e) {
            throw new TransportException("update " + range + " failed", e);
        }
        log.debug("cell_updated range={} value={}", range, value);
    }

    private JsonNode singleValue(SheetRef sheet, CellRef cell, String renderOption) {
        JsonNode json = execute(get(valuesUrl(sheet, cell, renderOption)), "read " + sheet.range(cell));
        JsonNode values = json.path("values");
        if (!values.isArray() || values.isEmpty()) return null;
        JsonNode row = values.get(0);
        if (!row.isArray() || row.isEmpty()) return null;
        return row.get(0);
    }

    private HttpUrl.Builder spreadsheetUrl(String spreadsheetId) {
        return baseUrl.newBuilder()
                .addPathSegments("v4/spreadsheets")
                .addPathSegment(spreadsheetId);
    }

    private HttpUrl.Builder valuesUrlBuilder(SheetRef sheet, CellRef cell) {
        return spreadsheetUrl(sheet.spreadsheetId())
                .addPathSegment("values")
                .addPathSegment(sheet.range(cell));
    }

    private HttpUrl valuesUrl(SheetRef sheet, CellRef cell, String renderOption) {
        return valuesUrlBuilder(sheet, cell)
                .addQueryParameter("valueRenderOption", renderOption)
                .addQueryParameter("majorDimension", "ROWS")
                .build();
    }

    private Request.Builder authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + tokens.accessToken());
    }

    private Request get(HttpUrl url) {
        return authorized(url).get().build();
    }

    private JsonNode execute(Request req, String what) {
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful() || resp.body() == null) {
                throw new TransportException("Sheets " + what + " failed: HTTP " + resp.code());
            }
            return mapper.readTree(resp.body().string());
        } catch (IOException e) {
            throw new TransportException("Sheets " + what + " error", e);
        }
    }
}
