package com.mod98.alpaca.earningsbot.Controller;

import com.mod98.alpaca.earningsbot.DTO.ApiErrorDTO;
import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Clock;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(BrokerUnavailableException.class)
    public ResponseEntity<ApiErrorDTO> brokerUnavailable(BrokerUnavailableException e) {
        log.warn("Broker unavailable for request: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(DataUnavailableException.class)
    public ResponseEntity<ApiErrorDTO> dataUnavailable(DataUnavailableException e) {
        log.warn("Market data unavailable for request: {}", e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ApiErrorDTO> invalid(Exception e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private ResponseEntity<ApiErrorDTO> body(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ApiErrorDTO(status.value(), status.getReasonPhrase(), message, clock.instant()));
    }
}
