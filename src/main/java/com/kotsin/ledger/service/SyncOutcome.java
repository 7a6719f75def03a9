package com.kotsin.ledger.service;

import com.kotsin.ledger.model.WriteResult;

/**
 * @param processed  fills handed to the ledger writer
 * @param written    fills that produced a ledger write
 * @param lastResult read-back of the last write, null when nothing was written
 */
public record SyncOutcome(int processed, int written, WriteResult lastResult) {
}
