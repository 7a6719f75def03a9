package com.kotsin.ledger.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide persisted state: the notification-channel cursor and the
 * exchange fill seen-set. Changed only through {@link DedupStateStore#update}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DedupState {

    @JsonProperty("last_update_id")
    private long lastUpdateId;

    @JsonProperty("default_chat_id")
    private Long defaultChatId;

    @JsonProperty("processed_upbit_fill_ids")
    private List<String> processedUpbitFillIds = new ArrayList<>();

    @JsonIgnore
    public SeenSet seenSet() {
        return SeenSet.of(processedUpbitFillIds == null ? List.of() : processedUpbitFillIds);
    }

    @JsonIgnore
    public void replaceSeenSet(SeenSet seen) {
        this.processedUpbitFillIds = new ArrayList<>(seen.toList());
    }
}
