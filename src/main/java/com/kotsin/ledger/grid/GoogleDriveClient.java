package com.kotsin.ledger.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.ledger.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Drive v3 calls used next to the grid store: xlsx export for local backups,
 * and spreadsheet lookup by title.
 */
@Service
@Slf4j
public class GoogleDriveClient {

    static final String XLSX_MIME = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    private static final String SPREADSHEET_MIME = "application/vnd.google-apps.spreadsheet";

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final AccessTokenProvider tokens;
    private final HttpUrl baseUrl;

    public GoogleDriveClient(OkHttpClient http,
                             ObjectMapper mapper,
                             AccessTokenProvider tokens,
                             @Value("${google.drive.base-url:https://www.googleapis.com}") String baseUrl) {
        this.http = http;
        this.mapper = mapper;
        this.tokens = tokens;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    public byte[] exportXlsx(String spreadsheetId) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("drive/v3/files")
                .addPathSegment(spreadsheetId)
                .addPathSegment("export")
                .addQueryParameter("mimeType", XLSX_MIME)
                .build();
        try (Response resp = http.newCall(authorized(url)).execute()) {
            if (!resp.isSuccessful() || resp.body() == null) {
                throw new TransportException("Drive export of " + spreadsheetId + " failed: HTTP " + resp.code());
            }
            return resp.body().bytes();
        } catch (IOException e) {
            throw new TransportException("Drive export of " + spreadsheetId + " error", e);
        }
    }

    public Optional<String> findSpreadsheetIdByTitle(String title) {
        String escaped = title.replace("\\", "\\\\").replace("'", "\\'");
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("drive/v3/files")
                .addQueryParameter("q", "name = '" + escaped + "' and mimeType = '" + SPREADSHEET_MIME
                        + "' and trashed = false")
                .addQueryParameter("fields", "files(id,name)")
                .addQueryParameter("pageSize", "10")
                .build();
        try (Response resp = http.newCall(authorized(url)).execute()) {
            if (!resp.isSuccessful() || resp.body() == null) {
                throw new TransportException("Drive search for '" + title + "' failed: HTTP " + resp.code());
            }
            JsonNode files = mapper.readTree(resp.body().string()).path("files");
            if (!files.isArray() || files.isEmpty()) {
                return Optional.empty();
            }
            if (files.size() > 1) {
                log.warn("drive_search_ambiguous title={} matches={} using first", title, files.size());
            }
            return Optional.of(files.get(0).path("id").asText());
        } catch (IOException e) {
            throw new TransportException("Drive search for '" + title + "' error", e);
        }
    }

    private Request authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + tokens.accessToken())
                .get()
                .build();
    }
}
