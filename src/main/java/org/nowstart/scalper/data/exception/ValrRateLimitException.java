package org.nowstart.scalper.data.exception;

public class ValrRateLimitException extends ExchangeException {

    public ValrRateLimitException(String message) {
        super(message);
    }
}
