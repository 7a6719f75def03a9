package com.kotsin.ledger.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.ledger.config.TelegramProps;
import com.kotsin.ledger.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bot API client: long-polling getUpdates and sendMessage.
 */
@Service
@Slf4j
public class TelegramClient {

    private final OkHttpClient pollHttp;
    private final OkHttpClient sendHttp;
    private final ObjectMapper mapper;
    private final TelegramProps props;

    public TelegramClient(OkHttpClient http, ObjectMapper mapper, TelegramProps props) {
        this.mapper = mapper;
        this.props = props;
        // long poll holds the connection open for the poll timeout
        this.pollHttp = http.newBuilder()
                .callTimeout(Duration.ofSeconds(props.pollTimeoutSeconds() + 10L))
                .readTimeout(Duration.ofSeconds(props.pollTimeoutSeconds() + 10L))
                .build();
        this.sendHttp = http.newBuilder()
                .callTimeout(Duration.ofSeconds(15))
                .build();
    }

    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
        HttpUrl url = botUrl("getUpdates").newBuilder()
                .addQueryParameter("offset", String.valueOf(offset))
                .addQueryParameter("timeout", String.valueOf(timeoutSeconds))
                .build();
        Request req = new Request.Builder().url(url).get().build();
        try (Response resp = pollHttp.newCall(req).execute()) {
            if (!resp.isSuccessful() || resp.body() == null) {
                throw new TransportException("Telegram getUpdates failed: HTTP " + resp.code());
            }
            JsonNode body = mapper.readTree(resp.body().string());
            if (!body.path("ok").asBoolean(false)) {
                throw new TransportException("telegram error: " + body);
            }
            List<TelegramUpdate> out = new ArrayList<>();
            for (JsonNode upd : body.path("result")) {
                out.add(TelegramUpdate.fromJson(upd));
            }
            return out;
        } catch (IOException e) {
            throw new TransportException("Telegram getUpdates error", e);
        }
    }

    public void sendMessage(long chatId, String text) {
        FormBody body = new FormBody.Builder()
                .add("chat_id", String.valueOf(chatId))
                .add("text", text)
                .build();
        Request req = new Request.Builder().url(botUrl("sendMessage")).post(body).build();
        try (Response resp = sendHttp.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new TransportException("Telegram sendMessage failed: HTTP " + resp.code());
            }
        } catch (IOException e) {
            throw new TransportException("Telegram sendMessage error", e);
        }
        log.info("telegram_reply_sent chat_id={}", chatId);
    }

    private HttpUrl botUrl(String method) {
        return HttpUrl.get(props.baseUrl()).newBuilder()
                .addPathSegment("bot" + props.botToken())
                .addPathSegment(method)
                .build();
    }
}
