package org.nowstart.scalper.data.exception;

/**
 * Raised when protective exit orders could not be placed for a filled entry.
 */
public class TradingException extends RuntimeException {

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
