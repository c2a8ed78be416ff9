package ch.so.arp.nexa.error;

import java.nio.file.InvalidPathException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps exceptions escaping the controllers to an {@link ErrorResponse} with a
 * status code matching the failure category.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String INTERNAL_ERROR = "RAG-500";

    @ExceptionHandler(RagException.class)
    public ResponseEntity<ErrorResponse> handleRagException(RagException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            LOGGER.error("[{}] {} - {} ({})", request.getMethod(), request.getRequestURI(), ex.getMessage(),
                    ex.getErrorCode().code(), ex);
        } else {
            LOGGER.warn("[{}] {} - {} ({})", request.getMethod(), request.getRequestURI(), ex.getMessage(),
                    ex.getErrorCode().code());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getErrorCode().code(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String message = firstError != null
                ? firstError.getField() + " " + firstError.getDefaultMessage()
                : ErrorCode.CONFIGURATION_INVALID.message();
        LOGGER.warn("[{}] {} - validation failed: {}", request.getMethod(), request.getRequestURI(), message);
        return badRequest(message);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, InvalidPathException.class })
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex, HttpServletRequest request) {
        LOGGER.warn("[{}] {} - unreadable request: {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage());
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        if (cause instanceof ConfigurationException) {
            return badRequest(cause.getMessage());
        }
        return badRequest(ex instanceof InvalidPathException ? ex.getMessage() : "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse springError) {
            HttpStatusCode status = springError.getStatusCode();
            return ResponseEntity.status(status)
                    .body(new ErrorResponse("HTTP-" + status.value(), springError.getBody().getDetail()));
        }
        LOGGER.error("[{}] {} - unexpected failure", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.internalServerError()
                .body(new ErrorResponse(INTERNAL_ERROR, "Internal server error"));
    }

    static HttpStatus statusOf(ErrorCode errorCode) {
        return switch (errorCode) {
            case CONFIGURATION_INVALID -> HttpStatus.BAD_REQUEST;
            case UNSUPPORTED_FORMAT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case INDEX_INCOMPATIBLE -> HttpStatus.CONFLICT;
            case EMBEDDING_UNAVAILABLE, GENERATION_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.CONFIGURATION_INVALID.code(), message));
    }
}
