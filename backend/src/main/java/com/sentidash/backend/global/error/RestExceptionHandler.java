package com.sentidash.backend.global.error;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestCookieException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = ex.getHttpStatus();
        ProblemResponse body = ProblemResponse.of(status, ex.getCode(), ex.getDetailMessage(), request.getRequestURI());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex instanceof RetryableProblemException retryable) {
            builder.header(HttpHeaders.RETRY_AFTER, Long.toString(retryable.getRetryAfterSeconds()));
        }
        return builder.body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, null);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "validation_error", detail, null);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingRequestCookieException.class})
    public ResponseEntity<ProblemResponse> handleMissingInput(Exception ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, "validation_error", ex.getMessage(), null);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied uri={} reason={}", request.getRequestURI(), ex.getMessage());
        HttpStatus status = HttpStatus.FORBIDDEN;
        return ResponseEntity.status(status).body(ProblemResponse.of(status, "FORBIDDEN", "FORBIDDEN", null));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemResponse> handleConflict(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Integrity violation uri={} cause={}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        HttpStatus status = HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(ProblemResponse.of(status, "CONFLICT", "CONFLICT", null));
    }

    @ExceptionHandler({
            TransactionTimedOutException.class,
            QueryTimeoutException.class,
            TransientDataAccessException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ProblemResponse> handleStoreUnavailable(Exception ex, HttpServletRequest request) {
        log.error("Store unavailable uri={}", request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status)
                .body(ProblemResponse.of(status, "STORE_UNAVAILABLE", "Temporarily unavailable", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception uri={}", request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, "internal_error", "Unexpected error", null);
        return ResponseEntity.status(status).body(body);
    }
}
