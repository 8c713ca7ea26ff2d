package com.vpnbot.api.platform;

import com.vpnbot.api.vpn.exceptions.ConsistencyViolationException;
import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;

/**
 * Exception handlers for errors that controllers don't translate into a response themselves.
 */
@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(Throwable.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleInternalError(@NonNull final Throwable e) {
        log.error("uncaught exception while processing the request", e);
    }

    @ExceptionHandler(ConsistencyViolationException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleConsistencyViolation(@NonNull final ConsistencyViolationException e) {
        log.error("ledger consistency violation, operator action required", e);
    }

    @ExceptionHandler({
        ObjectOptimisticLockingFailureException.class,
        PessimisticLockingFailureException.class,
        DataIntegrityViolationException.class,
    })
    @ResponseStatus(HttpStatus.CONFLICT)
    void handleConcurrentModification(@NonNull final Exception e) {
        log.warn("request lost a race against a concurrent ledger update", e);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    void handleHttpMediaTypeNotSupported(@NonNull final HttpMediaTypeNotSupportedException e) {
        log.trace("http media type not supported", e);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    void handleHttpRequestMethodNotSupported(final HttpRequestMethodNotSupportedException e) {
        log.trace("http method not supported", e);
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    void handleNotFound(final NoHandlerFoundException e) {
        log.trace("http handler not found", e);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        ServletRequestBindingException.class,
        BindException.class,
        MissingRequestHeaderException.class,
        TypeMismatchException.class,
        MethodArgumentNotValidException.class,
        ConstraintViolationException.class,
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    void handleBadRequest(final Throwable e) {
        log.trace("http request is not valid", e);
    }
}
