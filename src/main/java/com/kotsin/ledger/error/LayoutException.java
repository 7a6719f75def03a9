package com.kotsin.ledger.error;

/**
 * The ledger grid does not contain a recognisable header layout
 * (date / zone labels, or the running-total column).
 */
public class LayoutException extends RuntimeException {

    public LayoutException(String message) {
        super(message);
    }
}
