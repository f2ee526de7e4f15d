package com.contactcare.backend.global.error;

import java.util.stream.Collectors;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps every failure leaving a controller onto a {@link ProblemResponse}.
 * Client errors are logged at debug, server errors with their stack trace.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    static final String VALIDATION_ERROR = "validation_error";
    static final String MALFORMED_REQUEST = "malformed_request";
    static final String DATA_CONFLICT = "data_conflict";
    static final String INTERNAL_ERROR = "internal_error";

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblem(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = ex.getHttpStatus();
        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getCode(), ex);
        } else {
            log.debug("{} {} rejected: {} ({})", request.getMethod(), request.getRequestURI(),
                    ex.getCode(), ex.getDetailMessage());
        }
        return respond(ProblemResponse.of(ex, request.getRequestURI()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleStatus(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return respond(ProblemResponse.of(status, null, ex.getReason(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleInvalidBody(MethodArgumentNotValidException ex,
                                                             HttpServletRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return validationFailure(detail, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemResponse> handleConstraintViolation(ConstraintViolationException ex,
                                                                     HttpServletRequest request) {
        String detail = ex.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));
        return validationFailure(detail, request);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ProblemResponse> handleMalformed(Exception ex, HttpServletRequest request) {
        log.debug("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ProblemResponse.of(HttpStatus.BAD_REQUEST, MALFORMED_REQUEST, ex.getMessage(),
                request.getRequestURI()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                               HttpServletRequest request) {
        log.warn("Constraint rejected write to {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(ProblemResponse.of(HttpStatus.CONFLICT, DATA_CONFLICT,
                "The change conflicts with stored contact data", request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ProblemResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, ex.getMessage(),
                request.getRequestURI()));
    }

    private ResponseEntity<ProblemResponse> validationFailure(String detail, HttpServletRequest request) {
        String resolved = detail.isEmpty() ? "Validation failed" : detail;
        return respond(ProblemResponse.of(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR, resolved,
                request.getRequestURI()));
    }

    private static ResponseEntity<ProblemResponse> respond(ProblemResponse body) {
        return ResponseEntity.status(body.status()).body(body);
    }
}
