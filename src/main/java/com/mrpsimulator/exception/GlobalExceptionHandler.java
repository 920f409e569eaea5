package com.mrpsimulator.exception;

import com.mrpsimulator.config.RequestIdFilter;
import com.mrpsimulator.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_ERROR", fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "TYPE_MISMATCH", null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.BAD_REQUEST, "Constraint Violation",
                     "One or more parameters failed validation", request, "VALIDATION_ERROR", fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be parsed",
                     request, "MALFORMED_REQUEST", null);
    }

    @ExceptionHandler(SchemaException.class)
    public ResponseEntity<ApiError> handleSchema(SchemaException ex, HttpServletRequest request) {
        log.warn("Snapshot rejected | missingTables={}", ex.getMissingTables());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Schema Error", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(ScenarioValidationException.class)
    public ResponseEntity<ApiError> handleScenarioValidation(
            ScenarioValidationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Scenario", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(SnapshotNotLoadedException.class)
    public ResponseEntity<ApiError> handleNotLoaded(
            SnapshotNotLoadedException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Snapshot Not Loaded", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(EmptyScenarioException.class)
    public ResponseEntity<ApiError> handleEmptyScenario(
            EmptyScenarioException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Empty Scenario", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(SnapshotFileException.class)
    public ResponseEntity<ApiError> handleSnapshotFile(
            SnapshotFileException ex, HttpServletRequest request) {
        HttpStatus status = ex.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return build(status, "Snapshot File Error", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({UnknownTableException.class, ScenarioCancelledException.class})
    public ResponseEntity<ApiError> handleBadRequest(
            MrpSimulatorException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(
            JobNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestIdFilter.resolveRequestId(request))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
