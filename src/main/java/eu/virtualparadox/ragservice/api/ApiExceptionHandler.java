package eu.virtualparadox.ragservice.api;

import eu.virtualparadox.ragservice.api.dto.ErrorResponse;
import eu.virtualparadox.ragservice.query.QueryTimeoutException;
import eu.virtualparadox.ragservice.rag.embed.EmbeddingServiceException;
import eu.virtualparadox.ragservice.rag.index.IndexNotReadyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps query-time failures to HTTP statuses with a {@code {"detail": "..."}} body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IndexNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleNotReady(final IndexNotReadyException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(EmbeddingServiceException.class)
    public ResponseEntity<ErrorResponse> handleEmbeddingFailure(final EmbeddingServiceException e) {
        log.warn("Embedding service failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(final QueryTimeoutException e) {
        log.warn(e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(final MethodArgumentNotValidException e) {
        final String detail = e.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, detail.isEmpty() ? "Invalid request" : detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(final HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(final IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(final Exception e) {
        log.error("Request failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Query failed: " + e.getMessage());
    }

    private static String describe(final FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> respond(final HttpStatus status, final String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(detail));
    }
}
