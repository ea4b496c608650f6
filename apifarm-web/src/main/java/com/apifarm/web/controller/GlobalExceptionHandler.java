package com.apifarm.web.controller;

import com.apifarm.common.dto.ErrorResponse;
import com.apifarm.common.exception.ApiFarmException;
import com.apifarm.common.exception.DuplicateKeyException;
import com.apifarm.common.exception.DuplicateUserException;
import com.apifarm.common.exception.InvalidCredentialsException;
import com.apifarm.common.exception.KeyNotFoundException;
import com.apifarm.common.exception.KeyPoolExhaustedException;
import com.apifarm.common.exception.PersistenceException;
import com.apifarm.common.exception.UnauthorizedException;
import com.apifarm.common.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常处理器。
 * <p>
 * 客户端错误直接返回 4xx；上游与持久化错误返回 5xx，只给出最终结论。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({DuplicateUserException.class, DuplicateKeyException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleConflict(ApiFarmException e) {
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({InvalidCredentialsException.class, UnauthorizedException.class})
    public ResponseEntity<ErrorResponse> handleUnauthorized(ApiFarmException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(ErrorResponse.of(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(KeyNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNotFound(KeyNotFoundException e) {
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(KeyPoolExhaustedException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse handlePoolExhausted(KeyPoolExhaustedException e) {
        log.warn("Key 池耗尽: {}", e.getMessage());
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ErrorResponse handleUpstreamUnavailable(UpstreamUnavailableException e) {
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handlePersistence(PersistenceException e) {
        log.error("持久化失败: {}", e.getMessage());
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(ApiFarmException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleApiFarmException(ApiFarmException e) {
        log.warn("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ErrorResponse.of("VALIDATION_ERROR", "请求参数不合法: " + detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleMalformedBody(HttpMessageNotReadableException e) {
        return ErrorResponse.of("MALFORMED_REQUEST", "请求体不是合法的 JSON");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public ErrorResponse handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ErrorResponse.of("METHOD_NOT_ALLOWED", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGenericException(Exception e) {
        log.error("系统异常", e);
        return ErrorResponse.of("SYSTEM_ERROR", "系统内部错误，请稍后重试");
    }
}
