package com.driftmonitor.exception;

import com.driftmonitor.config.RequestGuardFilter;
import com.driftmonitor.dto.ApiError;
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
                     "One or more fields failed validation", request, "VALIDATION_FAILED", fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations().stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more parameters failed validation", request, "VALIDATION_FAILED", fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "TYPE_MISMATCH", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be parsed",
                     request, "MALFORMED_REQUEST", null);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(
            InvalidRequestException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({NoBaselineException.class, ResourceNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            DriftMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(InvalidThresholdTableException.class)
    public ResponseEntity<ApiError> handleThresholdTable(
            InvalidThresholdTableException ex, HttpServletRequest request) {
        log.warn("Threshold table rejected: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Threshold Table", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(DataException.class)
    public ResponseEntity<ApiError> handleData(DataException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Data", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({ConcurrencyException.class, IllegalStateTransitionException.class})
    public ResponseEntity<ApiError> handleConflict(DriftMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(BatchSizeExceededException.class)
    public ResponseEntity<ApiError> handleBatchTooLarge(
            BatchSizeExceededException ex, HttpServletRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Batch Too Large", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(AnalysisTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(AnalysisTimeoutException ex, HttpServletRequest request) {
        return build(HttpStatus.GATEWAY_TIMEOUT, "Analysis Timeout", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(DeliveryException.class)
    public ResponseEntity<ApiError> handleDelivery(DeliveryException ex, HttpServletRequest request) {
        log.error("Delivery error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Delivery Failed", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(DriftMonitorException.class)
    public ResponseEntity<ApiError> handleDomain(DriftMonitorException ex, HttpServletRequest request) {
        log.error("Unhandled domain error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(),
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

        Object resolved = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        String reqId = resolved != null ? resolved.toString() : request.getHeader("X-Request-ID");

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .requestId(reqId)
            .errorCode(errorCode)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
