package quest.gekko.trends.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.trends.exception.StoreUnavailableException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public record ErrorBody(int status, String error, String path, Instant timestamp) {}

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        log.warn("Response status exception: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        int status = ex.getStatusCode().value();
        return ResponseEntity.status(status).body(body(status, ex.getReason(), request));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorBody handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(400, "Invalid request: " + ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ErrorBody handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied for URL: {}", request.getRequestURL());
        return body(403, "Access denied", request);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorBody handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        log.error("Store unavailable for URL: {}", request.getRequestURL(), ex);
        return body(503, "Trend store is unavailable, retry later", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleGeneralException(Exception ex, HttpServletRequest request) {
        // framework exceptions (missing route, wrong method, missing parameter) carry their own status
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} for URL: {}", ex.getMessage(), request.getRequestURL());
            int status = framework.getStatusCode().value();
            return ResponseEntity.status(status).body(body(status, ex.getMessage(), request));
        }
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(500, "An unexpected error occurred", request));
    }

    private static ErrorBody body(int status, String error, HttpServletRequest request) {
        return new ErrorBody(status, error, request.getRequestURI(), Instant.now());
    }
}
