package com.kotsin.ledger.telegram;

import com.kotsin.ledger.config.TelegramProps;
import com.kotsin.ledger.error.TransportException;
import com.kotsin.ledger.service.ErrorMonitoringService;
import com.kotsin.ledger.state.DedupState;
import com.kotsin.ledger.state.DedupStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * The single sequential control loop: fetch a batch of updates, handle each one to
 * completion, persist the cursor. A failing update is logged and skipped. A remote
 * failure stops the batch before that update and pauses polling for a coarse back-off,
 * so the update is handled again on the next attempt.
 */
@Component
@Slf4j
public class TelegramUpdatePoller {

    static final long MIN_BACKOFF_MS = 3000;

    private final TelegramClient telegram;
    private final UpdateDispatcher dispatcher;
    private final DedupStateStore stateStore;
    private final TelegramProps props;
    private final ErrorMonitoringService errors;
    private final Clock clock;

    private boolean initialized;
    private long offset;
    private long pausedUntilMillis;

    public TelegramUpdatePoller(TelegramClient telegram,
                                UpdateDispatcher dispatcher,
                                DedupStateStore stateStore,
                                TelegramProps props,
                                ErrorMonitoringService errors,
                                Clock clock) {
        this.telegram = telegram;
        this.dispatcher = dispatcher;
        this.stateStore = stateStore;
        this.props = props;
        this.errors = errors;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${telegram.poll-interval-ms:2000}")
    public void pollCycle() {
        if (!props.isConfigured()) {
            log.debug("Telegram not configured; skipping poll.");
            return;
        }
        if (clock.millis() < pausedUntilMillis) {
            return;
        }
        try {
            if (!initialized) {
                initialize();
            }
            List<TelegramUpdate> updates = telegram.getUpdates(offset, props.pollTimeoutSeconds());
            if (!updates.isEmpty()) {
                log.info("updates_received count={}", updates.size());
            }
            for (TelegramUpdate update : updates) {
                try {
                    dispatcher.handle(update);
                } catch (TransportException e) {
                    commitCursor();
                    throw e;
                } catch (Exception e) {
                    errors.recordError("update", "error(update_id=" + update.updateId() + "): " + e, e);
                }
                offset = Math.max(offset, update.updateId() + 1);
            }
            commitCursor();
        } catch (Exception e) {
            log.error("poll_cycle_failed error={}", e.toString());
            pausedUntilMillis = clock.millis() + Math.max(MIN_BACKOFF_MS, props.pollIntervalMs());
        }
    }

    private void commitCursor() {
        long lastHandled = offset - 1;
        stateStore.update(s -> s.setLastUpdateId(lastHandled));
        stateStore.save();
    }

    long offset() {
        return offset;
    }

    private void initialize() {
        DedupState state = stateStore.current();
        offset = state.getLastUpdateId() + 1;

        if (!stateStore.existedAtStartup() && props.startFromLatest()) {
            List<TelegramUpdate> pending = telegram.getUpdates(0, 0);
            if (!pending.isEmpty()) {
                offset = pending.stream().mapToLong(TelegramUpdate::updateId).max().getAsLong() + 1;
                long lastSkipped = offset - 1;
                stateStore.update(s -> s.setLastUpdateId(lastSkipped));
                stateStore.save();
                log.info("warmup_skip_old_updates count={} offset={}", pending.size(), offset);
            }
        }
        initialized = true;
        log.info("poller_started offset={}", offset);
    }
}
