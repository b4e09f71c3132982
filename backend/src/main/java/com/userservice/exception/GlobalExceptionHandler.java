package com.userservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Turns every failure into one of the {@link ErrorKind}s and renders it as
 * an {@link ErrorResponse}. Framework exceptions are first converted to the
 * matching {@link ApiException}, so {@link #toResponse(ApiException)} is the
 * only place a status and body are produced.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String ROUTE_RESOURCE = "route";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex) {
        return toResponse(ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .sorted()
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "invalid request body";
        }
        return toResponse(new ValidationException(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return toResponse(new ValidationException("invalid request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return toResponse(new ValidationException("invalid " + ex.getName() + ": " + ex.getValue()));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        return toResponse(new ValidationException("unsupported content type: " + ex.getContentType()));
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<ErrorResponse> handleNotAcceptable(HttpMediaTypeNotAcceptableException ex) {
        return toResponse(new ValidationException("not acceptable: responses are " + MediaType.APPLICATION_JSON_VALUE));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return toResponse(new ValidationException("method not allowed: " + ex.getMethod()));
    }

    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<ErrorResponse> handleBindingException(ServletRequestBindingException ex) {
        return toResponse(new ValidationException(ex.getMessage()));
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> handleUnknownRoute(Exception ex) {
        return toResponse(new NotFoundException(ROUTE_RESOURCE));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStorageFailure(RuntimeException ex) {
        return toResponse(new DatabaseException(ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        return toResponse(new InternalException(ex));
    }

    ResponseEntity<ErrorResponse> toResponse(ApiException ex) {
        ErrorKind kind = ex.getKind();
        if (kind.isRedacted()) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("{} failure: {}", kind, cause.getMessage(), cause);
        } else {
            log.warn("{}: {}", kind, ex.getMessage());
        }
        ErrorResponse body = ErrorResponse.of(ex.getPublicMessage(), kind.getStatus().value());
        // Always JSON, whatever the Accept header asks for
        return ResponseEntity.status(kind.getStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
