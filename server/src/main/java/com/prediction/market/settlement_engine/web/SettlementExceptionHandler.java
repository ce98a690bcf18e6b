package com.prediction.market.settlement_engine.web;

import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.prediction.market.settlement_engine.exception.ErrorKind;
import com.prediction.market.settlement_engine.exception.MarketClosedException;
import com.prediction.market.settlement_engine.exception.SettlementException;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.web.dto.ErrorResponse;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class SettlementExceptionHandler {

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ErrorResponse> handle(SettlementException e) {
        HttpStatus status = statusOf(e);
        String retryToken = e instanceof SettlementPendingException pending ? pending.getRetryToken() : null;
        if (status.is5xxServerError()) {
            log.warn("settlement dependency failure: code={} message={}", e.getCode(), e.getMessage());
        } else {
            log.debug("request rejected: status={} code={} message={}", status.value(), e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getCode(), e.getKind().name(), e.getMessage(), retryToken));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handle(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handle(HttpMessageNotReadableException e) {
        return badRequest("Malformed request body: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handle(MissingServletRequestParameterException e) {
        return badRequest(e.getMessage());
    }

    static HttpStatus statusOf(SettlementException e) {
        if (e instanceof MarketClosedException) {
            return HttpStatus.FORBIDDEN;
        }
        return switch (e.getKind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case RESOURCE -> HttpStatus.PAYMENT_REQUIRED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case DEPENDENCY -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("INVALID_REQUEST", ErrorKind.VALIDATION.name(), message, null));
    }
}
