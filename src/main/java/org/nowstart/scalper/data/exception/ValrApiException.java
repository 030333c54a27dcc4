package org.nowstart.scalper.data.exception;

import lombok.Getter;

@Getter
public class ValrApiException extends ExchangeException {

    private final int httpStatus;
    private final String code;

    public ValrApiException(int httpStatus, String code, String message) {
        super(message);
        this.httpStatus = httpStatus;
        this.code = code;
    }

    public boolean isNotFound() {
        return httpStatus == 404;
    }
}
