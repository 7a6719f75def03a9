package com.kotsin.ledger.controller;

import com.kotsin.ledger.config.UpbitProps;
import com.kotsin.ledger.service.ReplyFormatter;
import com.kotsin.ledger.service.SyncOutcome;
import com.kotsin.ledger.service.UpbitSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manual trigger for the exchange sync, same semantics as the chat command.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerSyncController {

    private final UpbitSyncService upbitSync;
    private final UpbitProps upbitProps;
    private final Clock clock;

    @PostMapping("/upbit/sync")
    public ResponseEntity<Map<String, Object>> syncUpbit(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        if (!upbitProps.enabled()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "upbit sync disabled"));
        }
        if (!upbitProps.hasKeys()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "upbit api keys not configured"));
        }

        boolean explicit = date != null;
        LocalDate target = explicit ? date : LocalDate.now(clock);
        log.info("upbit_sync_requested date={} explicit={}", target, explicit);
        SyncOutcome outcome = upbitSync.runOnce(target, explicit, "upbit_api_" + target);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("date", target.toString());
        body.put("explicit", explicit);
        body.put("processed", outcome.processed());
        body.put("written", outcome.written());
        body.put("reply", ReplyFormatter.syncReply(outcome));
        return ResponseEntity.ok(body);
    }
}
