package com.kotsin.ledger.exchange;

import com.kotsin.ledger.model.FillEvent;
import com.kotsin.ledger.state.SeenSet;

import java.util.List;

/**
 * @param newEvents   fills to apply, oldest first
 * @param updatedSeen seen-set including every forwarded fill, already truncated
 * @param stats       per-reason counters for the raw rows
 */
public record ReconcileResult(List<FillEvent> newEvents, SeenSet updatedSeen, Stats stats) {

    public record Stats(int rows, int fills, int skipDate, int skipMarket, int skipSide,
                        int skipQty, int skipAmount, int skipSeen) {
    }
}
