package com.rewardradar.api.controller;

import com.rewardradar.api.dto.ErrorBody;
import com.rewardradar.client.CredentialsInvalidException;
import com.rewardradar.client.RewardsApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps unreadable request bodies to 400 and upstream API failures to 502, with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason() != null
                ? ex.getReason() : "Invalid request"));
    }

    @ExceptionHandler(CredentialsInvalidException.class)
    public ResponseEntity<ErrorBody> handleCredentials(CredentialsInvalidException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("CREDENTIALS_INVALID", ex.getMessage()));
    }

    @ExceptionHandler(RewardsApiException.class)
    public ResponseEntity<ErrorBody> handleApi(RewardsApiException ex) {
        log.warn("Request failed upstream: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("UPSTREAM_ERROR", ex.getMessage()));
    }
}
