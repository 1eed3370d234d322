package com.signalsync.cloud.controller;

import com.signalsync.cloud.dto.ErrorResponse;
import com.signalsync.cloud.service.SessionNotFoundException;
import com.signalsync.shared.error.InvalidRangeException;
import com.signalsync.shared.error.NoRoiConfiguredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ErrorResponse> invalidRange(InvalidRangeException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_RANGE", e);
    }

    @ExceptionHandler(NoRoiConfiguredException.class)
    public ResponseEntity<ErrorResponse> noRoi(NoRoiConfiguredException e) {
        return error(HttpStatus.CONFLICT, "NO_ROI_CONFIGURED", e);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> unknownSession(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, RuntimeException e) {
        log.warn("{}: {}", code, e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage()));
    }
}
