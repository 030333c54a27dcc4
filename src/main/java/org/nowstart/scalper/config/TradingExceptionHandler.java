package org.nowstart.scalper.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.exception.PositionNotFoundException;
import org.nowstart.scalper.data.exception.ValrApiException;
import org.nowstart.scalper.data.exception.ValrConnectionException;
import org.nowstart.scalper.data.exception.ValrRateLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TradingExceptionHandler {

    @ExceptionHandler(PositionNotFoundException.class)
    public ProblemDetail handlePositionNotFoundException(PositionNotFoundException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, exception.getMessage());
        problemDetail.setProperty("code", "position_not_found");
        problemDetail.setProperty("positionId", exception.getPositionId());
        return problemDetail;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationException(MethodArgumentNotValidException exception) {
        List<String> details = exception.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException exception) {
        List<String> details = exception.getConstraintViolations()
                .stream()
                .map(ConstraintViolation::getMessage)
                .toList();

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }

    @ExceptionHandler(ExchangeException.class)
    public ProblemDetail handleExchangeException(ExchangeException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, exception.getMessage());
        if (exception instanceof ValrApiException apiException) {
            problemDetail.setProperty("code", apiException.getCode());
            problemDetail.setProperty("upstreamStatus", apiException.getHttpStatus());
        } else if (exception instanceof ValrRateLimitException) {
            problemDetail.setStatus(HttpStatus.SERVICE_UNAVAILABLE);
            problemDetail.setProperty("code", "valr_rate_limited");
        } else if (exception instanceof ValrConnectionException) {
            problemDetail.setProperty("code", "valr_unreachable");
        } else {
            problemDetail.setProperty("code", "valr_error");
        }
        return problemDetail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException() {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected server error"
        );
        problemDetail.setProperty("code", "internal_error");
        return problemDetail;
    }
}
