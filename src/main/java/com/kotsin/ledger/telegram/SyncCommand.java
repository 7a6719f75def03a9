package com.kotsin.ledger.telegram;

import java.time.LocalDate;

/**
 * @param targetDate   day to reconcile
 * @param explicitDate true when the date was given in the command (replay everything for that day)
 */
public record SyncCommand(LocalDate targetDate, boolean explicitDate) {
}
