package com.kotsin.ledger.exchange;

import com.kotsin.ledger.error.TransportException;

import java.util.List;

/**
 * Paginated access to the exchange's closed-order history, newest first.
 */
public interface TradeHistorySource {

    /** one page (1-based); empty when past the last page */
    List<UpbitOrder> fetchPage(int page) throws TransportException;
}
