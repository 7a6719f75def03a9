package com.kotsin.ledger.service;

import com.kotsin.ledger.config.LedgerProps;
import com.kotsin.ledger.config.UpbitProps;
import com.kotsin.ledger.exchange.FillReconciler;
import com.kotsin.ledger.exchange.ReconcileResult;
import com.kotsin.ledger.exchange.TradeFilter;
import com.kotsin.ledger.exchange.TradeHistorySource;
import com.kotsin.ledger.exchange.UpbitOrder;
import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.model.WriteResult;
import com.kotsin.ledger.state.DedupStateStore;
import com.kotsin.ledger.state.SeenSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One exchange reconciliation pass for a target day: fetch, dedupe, apply in time order,
 * record applied ids. Serialised so the poller and the REST trigger never overlap.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpbitSyncService {

    private final TradeHistorySource tradeHistory;
    private final FillReconciler reconciler;
    private final LedgerWriter ledgerWriter;
    private final DedupStateStore stateStore;
    private final UpbitProps upbitProps;
    private final LedgerProps ledgerProps;

    public synchronized SyncOutcome runOnce(LocalDate targetDate, boolean explicitDate, String backupContext) {
        List<UpbitOrder> raw = reconciler.collect(tradeHistory, upbitProps.maxPages());

        SeenSet seen = stateStore.current().seenSet();
        TradeFilter filter = new TradeFilter(targetDate, ledgerProps.zoneId(),
                upbitProps.market(), upbitProps.marketAsset());
        ReconcileResult result = reconciler.reconcile(raw, seen, explicitDate, filter);
        if (!result.newEvents().isEmpty()) {
            log.info("upbit_sync_new_fills count={} market={}", result.newEvents().size(), upbitProps.market());
        }

        int processed = 0;
        int written = 0;
        WriteResult last = null;
        List<String> applied = new ArrayList<>();
        try {
            for (FillEvent fill : result.newEvents()) {
                processed++;
                Optional<WriteResult> r = ledgerWriter.applyExchangeFill(fill, upbitProps.sheetSymbol(), backupContext);
                applied.add(fill.getIdempotencyKey());
                if (r.isPresent()) {
                    written++;
                    last = r.get();
                }
            }
            stateStore.update(s -> s.replaceSeenSet(result.updatedSeen()));
        } catch (RuntimeException e) {
            // keep what was applied before the failure; the rest is retried next time
            stateStore.update(s -> s.replaceSeenSet(seen.plusAll(applied)));
            throw e;
        } finally {
            stateStore.save();
        }
        return new SyncOutcome(processed, written, last);
    }
}
