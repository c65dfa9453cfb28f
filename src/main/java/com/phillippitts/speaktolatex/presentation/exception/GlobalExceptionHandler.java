package com.phillippitts.speaktolatex.presentation.exception;

import com.phillippitts.speaktolatex.exception.InvalidAudioException;
import com.phillippitts.speaktolatex.exception.InvalidInputException;
import com.phillippitts.speaktolatex.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps exceptions at the REST boundary to status codes and a uniform error body.
 * Internal messages are logged, not returned.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    ResponseEntity<ApiError> handleInvalidInput(InvalidInputException ex) {
        LOG.warn("Invalid input: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Invalid input", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        LOG.warn("Request validation failed: {} error(s)", ex.getErrorCount());
        return badRequest("InvalidInputException", "Invalid input", "No text provided");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return badRequest("InvalidInputException", "Invalid input", "Request body is not valid JSON");
    }

    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return badRequest(ex.getClass().getSimpleName(), "Invalid audio upload", ex.getMessage());
    }

    /**
     * No usable speech engine (HTTP 503).
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        LOG.error("Transcription unavailable: engine={}", ex.getEngineName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Speech recognition unavailable",
                "Use the text endpoint or retry later",
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
                "Please contact support with the request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String code, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Error body returned to API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
