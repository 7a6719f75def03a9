package com.kotsin.ledger.error;

/**
 * A source message, date or number could not be parsed. The event is dropped
 * before it reaches the ledger.
 */
public class FillParseException extends RuntimeException {

    public FillParseException(String message) {
        super(message);
    }

    public FillParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
