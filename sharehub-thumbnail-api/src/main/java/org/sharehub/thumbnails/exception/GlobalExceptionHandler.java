package org.sharehub.thumbnails.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({TenantNotFoundException.class, EventNotFoundException.class, SlideNotFoundException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(AbstractThumbnailException ex) {
        log.warn("{}: {}", ex.getError(), ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidSignature(InvalidWebhookSignatureException ex) {
        log.warn("Rejected webhook: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({InvalidWebhookPayloadException.class, ConversionJobNotFoundException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidWebhook(AbstractThumbnailException ex) {
        log.warn("Rejected webhook ({}): {}", ex.getError(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ThumbnailRetryConflictException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRetryConflict(ThumbnailRetryConflictException ex) {
        log.warn("Retry conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStorageException(StorageException ex) {
        log.error("Storage exception: {}", ex.getMessage(), ex.getCause());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Storage operation failed: " + ex.getMessage());
    }

    @ExceptionHandler(ConversionSubmissionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConversionSubmission(ConversionSubmissionException ex) {
        log.error("Conversion submission failed: {}", ex.getMessage(), ex.getCause());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationExceptions(WebExchangeBindException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleServerWebInput(ServerWebInputException ex) {
        log.warn("Invalid request input: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Illegal argument : {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Throwable.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Throwable ex) {
        log.error("An unexpected error occurred", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.");
    }

    private static Mono<ResponseEntity<ErrorResponse>> error(HttpStatus status, String message) {
        return Mono.just(ResponseEntity.status(status).body(new ErrorResponse(status.value(), message)));
    }

    public record ErrorResponse(int status, String message) {
    }
}
