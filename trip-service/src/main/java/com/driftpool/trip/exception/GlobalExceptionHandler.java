package com.driftpool.trip.exception;

import com.driftpool.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps trip errors to {@link ApiResponse} bodies. The error code travels unchanged; the HTTP
 * status follows the exception type.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TripException.class)
    public ResponseEntity<ApiResponse<Void>> handleTripException(TripException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Trip error [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("Trip error [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_ERROR", message));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_ERROR", ex.getMessage()));
    }

    static HttpStatus statusFor(TripException ex) {
        if (ex instanceof TripValidationException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof OutOfServiceAreaException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof TripNotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof TripAccessDeniedException) return HttpStatus.FORBIDDEN;
        if (ex instanceof AlreadyAcceptedException || ex instanceof InvalidTripStateException) return HttpStatus.CONFLICT;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
