package com.kotsin.ledger.error;

/**
 * Generic wrapper for any failure while talking to a remote collaborator
 * (grid store, trade-history API, notification channel, token endpoint).
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
