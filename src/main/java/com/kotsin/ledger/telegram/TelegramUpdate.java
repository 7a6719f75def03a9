package com.kotsin.ledger.telegram;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parts of a notification-channel update the service uses.
 */
public record TelegramUpdate(long updateId, Long chatId, String text) {

    private static final String[] MESSAGE_KEYS = {"message", "edited_message", "channel_post", "edited_channel_post"};

    public static TelegramUpdate fromJson(JsonNode node) {
        long updateId = node.path("update_id").asLong();
        String text = null;
        Long chatId = null;
        for (String key : MESSAGE_KEYS) {
            JsonNode part = node.path(key);
            if (text == null) {
                String t = part.path("text").asText(null);
                if (t != null && !t.isEmpty()) text = t;
            }
            if (chatId == null && part.path("chat").hasNonNull("id")) {
                chatId = part.path("chat").path("id").asLong();
            }
        }
        return new TelegramUpdate(updateId, chatId, text);
    }
}
