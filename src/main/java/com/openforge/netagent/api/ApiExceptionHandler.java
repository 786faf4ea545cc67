package com.openforge.netagent.api;

import com.openforge.netagent.agent.QueryFailedException;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.planner.PlanningAmbiguousException;
import com.openforge.netagent.registry.DuplicateToolException;
import com.openforge.netagent.registry.UnknownToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps agent exceptions to HTTP responses with a {code, message} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        log.warn("[Api] Validation error: {}", message);
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("[Api] Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is not valid JSON");
    }

    @ExceptionHandler(UnknownToolException.class)
    public ResponseEntity<ErrorResponse> handleUnknownTool(UnknownToolException ex) {
        log.warn("[Api] {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "UNKNOWN_TOOL", ex.getMessage());
    }

    @ExceptionHandler(DuplicateToolException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateTool(DuplicateToolException ex) {
        log.warn("[Api] {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "DUPLICATE_TOOL", ex.getMessage());
    }

    @ExceptionHandler(PlanningAmbiguousException.class)
    public ResponseEntity<ErrorResponse> handlePlanningAmbiguous(PlanningAmbiguousException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "PLANNING_AMBIGUOUS", ex.getMessage());
    }

    @ExceptionHandler(QueryFailedException.class)
    public ResponseEntity<ErrorResponse> handleQueryFailed(QueryFailedException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.kind().name(), ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return error(status, status.name(), ex.getReason());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        log.error("[Api] Configuration error: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "CONFIGURATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("[Api] Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }

    public record ErrorResponse(String code, String message) {}
}
