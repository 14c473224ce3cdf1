package com.exifworker.app.rest;

import com.exifworker.core.exception.PipeResultException;
import com.exifworker.core.exception.TaskNotFoundException;
import com.exifworker.core.exception.WorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps worker exceptions that escape the dispatcher to HTTP responses.
 */
@RestControllerAdvice
public class WorkerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkerExceptionHandler.class);

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TaskNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(PipeResultException.class)
    public ResponseEntity<ErrorResponse> handleBadPipeResult(PipeResultException e) {
        log.warn("Rejected piped result: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, WorkerException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
