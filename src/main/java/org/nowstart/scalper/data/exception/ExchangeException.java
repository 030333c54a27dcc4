package org.nowstart.scalper.data.exception;

/**
 * Base type for every failure surfaced by the VALR gateway.
 */
public class ExchangeException extends RuntimeException {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
