package com.phillippitts.makeready.presentation.exception;

import com.phillippitts.makeready.exception.InvalidSourceDocumentException;
import com.phillippitts.makeready.exception.PoleProcessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Responses never echo document content.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed document or request (HTTP 400).
     */
    @ExceptionHandler(InvalidSourceDocumentException.class)
    ResponseEntity<ApiError> handleInvalidDocument(InvalidSourceDocumentException ex) {
        LOG.warn("Invalid document: name={}, reason={}", ex.getDocumentName(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid source document",
                ex.getDocumentName() + ": " + ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * A pole could not be built and the batch was aborted (HTTP 422).
     */
    @ExceptionHandler(PoleProcessingException.class)
    ResponseEntity<ApiError> handlePoleFailure(PoleProcessingException ex) {
        LOG.error("Report batch aborted: node={}, pole={}", ex.getNodeId(), ex.getPoleNumber(), ex);
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Pole could not be processed",
                "Pole " + ex.getPoleNumber() + " (node " + ex.getNodeId() + ")",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with the batch ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
