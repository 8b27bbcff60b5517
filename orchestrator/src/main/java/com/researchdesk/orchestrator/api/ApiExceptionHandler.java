package com.researchdesk.orchestrator.api;

import com.researchdesk.orchestrator.api.dto.ErrorResponse;
import com.researchdesk.orchestrator.service.JobNotFoundException;
import com.researchdesk.orchestrator.service.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps caller errors to 400/404 with an {@link ErrorResponse} body.
 * Pipeline failures never get here; they live in the job's status.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(JobNotFoundException e) {
        log.info("{}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, "Job not found", e.getMessage());
    }

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<ErrorResponse> invalid(JobValidationException e) {
        log.info("Rejected research request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        log.info("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request", "request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> badArgument(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request",
                "invalid value for '" + e.getName() + "': " + e.getValue());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, message));
    }
}
