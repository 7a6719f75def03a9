package com.kotsin.ledger.telegram;

import com.kotsin.ledger.config.UpbitProps;
import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.WriteResult;
import com.kotsin.ledger.service.LedgerWriter;
import com.kotsin.ledger.service.ReplyFormatter;
import com.kotsin.ledger.service.SyncOutcome;
import com.kotsin.ledger.service.UpbitSyncService;
import com.kotsin.ledger.state.DedupStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Routes one update: the exchange sync command, a brokerage fill notification, or nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpdateDispatcher {

    static final String REPLY_UPBIT_DISABLED = "업비트 기능이 비활성화되어 있습니다. (UPBIT_ENABLED=false)";
    static final String REPLY_UPBIT_NO_KEYS = "업비트 API 키가 설정되지 않았습니다.";
    static final String REPLY_FILL_NOT_CLASSIFIED = "평단가를 확인할 수 없어 기입하지 못했습니다: ";

    private final SyncCommandParser commandParser;
    private final BrokerFillMessageParser fillParser;
    private final UpbitSyncService upbitSync;
    private final LedgerWriter ledgerWriter;
    private final TelegramClient telegram;
    private final DedupStateStore stateStore;
    private final UpbitProps upbitProps;

    public void handle(TelegramUpdate update) {
        String text = update.text();
        if (text == null) return;

        long updateId = update.updateId();
        Long chatId = update.chatId();
        log.info("update_processing update_id={}", updateId);
        if (chatId != null) {
            stateStore.update(s -> s.setDefaultChatId(chatId));
        }

        Optional<SyncCommand> command = commandParser.parse(text, upbitProps.commandText());
        if (command.isPresent()) {
            handleSyncCommand(updateId, chatId, command.get());
            return;
        }

        Optional<FillEvent> fill = fillParser.parse(text);
        if (fill.isEmpty()) return;

        FillEvent f = fill.get();
        log.info("fill_message_parsed update_id={} symbol={} side={} price={} qty={}",
                updateId, f.getSymbol(), f.getSide(), f.getPrice(), f.getQty());
        Optional<WriteResult> result;
        try {
            result = ledgerWriter.applyBrokerageFill(f, "meritz_update_" + updateId);
        } catch (IllegalArgumentException e) {
            // ledger untouched; tell the chat before the poller records the failure
            reply(chatId, REPLY_FILL_NOT_CLASSIFIED + f.getSymbol());
            throw e;
        }
        result.ifPresent(r -> reply(chatId, ReplyFormatter.fillReply(r)));
        log.info("processed update_id={} symbol={}", updateId, f.getSymbol());
    }

    private void handleSyncCommand(long updateId, Long chatId, SyncCommand command) {
        if (!upbitProps.enabled()) {
            reply(chatId, REPLY_UPBIT_DISABLED);
            log.info("upbit_command_ignored_disabled");
            return;
        }
        if (!upbitProps.hasKeys()) {
            reply(chatId, REPLY_UPBIT_NO_KEYS);
            log.info("upbit_command_ignored_missing_keys");
            return;
        }
        SyncOutcome outcome = upbitSync.runOnce(command.targetDate(), command.explicitDate(),
                "upbit_update_" + updateId + "_" + command.targetDate());
        reply(chatId, ReplyFormatter.syncReply(outcome));
        log.info("upbit_command_done date={} processed={} written={}",
                command.targetDate(), outcome.processed(), outcome.written());
    }

    private void reply(Long chatId, String text) {
        if (chatId != null) {
            telegram.sendMessage(chatId, text);
        }
    }
}
