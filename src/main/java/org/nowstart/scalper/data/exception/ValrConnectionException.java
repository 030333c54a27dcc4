package org.nowstart.scalper.data.exception;

public class ValrConnectionException extends ExchangeException {

    public ValrConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
