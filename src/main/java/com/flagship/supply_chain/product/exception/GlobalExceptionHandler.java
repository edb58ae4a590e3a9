package com.flagship.supply_chain.product.exception;

import com.flagship.supply_chain.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps rejections to HTTP responses.
 *
 * Lifecycle rejections keep the status of their {@link FailureReason} and echo the reason
 * in the body, so clients can tell UNAUTHORIZED from NOT_VERIFIED (both 403). Malformed
 * input is 400 without a reason. Anything else is a 500 and is logged with its stack trace.
 * Lifecycle rejections are not logged again here; the service already logged them.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProductLifecycleException.class)
    public ResponseEntity<ErrorResponse> handleLifecycle(ProductLifecycleException e) {
        FailureReason reason = e.getReason();
        Map<String, String> details = e.getProductId() == null
            ? null
            : Map.of("productId", e.getProductId().toString());

        return respond(reason.getHttpStatus(), reason.getHttpStatus().getReasonPhrase(),
            reason, e.getMessage(), details);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fields = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                FieldError::getField,
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (first, ignored) -> first
            ));
        log.warn("Validation failed on fields {}", fields.keySet());

        return badRequest("Validation Failed", "Request validation failed", fields);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return badRequest("Invalid Request", "Malformed request", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        // Transitions log these at WARN themselves
        log.debug("Invalid argument: {}", e.getMessage());
        return badRequest("Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
            "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> badRequest(String error, String message, Map<String, String> details) {
        return respond(HttpStatus.BAD_REQUEST, error, null, message, details);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, FailureReason reason,
                                                  String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .reason(reason == null ? null : reason.name())
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.currentCorrelationId())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error body. {@code reason} is set only for lifecycle rejections.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String reason;
        String message;
        Map<String, String> details;
        String correlationId;
        Instant timestamp;
    }
}
