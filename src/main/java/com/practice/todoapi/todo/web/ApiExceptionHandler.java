package com.practice.todoapi.todo.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.practice.todoapi.todo.domain.exception.TodoNotFoundException;
import com.practice.todoapi.todo.domain.exception.TodoStorageException;
import com.practice.todoapi.todo.domain.exception.TodoValidationException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TodoNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(TodoNotFoundException ex) {
        log.debug(ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "resource not found");
    }

    @ExceptionHandler(TodoValidationException.class)
    public ResponseEntity<ErrorResponse> validation(TodoValidationException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "validation error: " + ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .orElse("invalid request body");
        return error(HttpStatus.BAD_REQUEST, "bad request: " + detail);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ErrorResponse> badRequest(Exception ex) {
        log.debug("Rejected request", ex);
        return error(HttpStatus.BAD_REQUEST, "bad request: malformed request");
    }

    @ExceptionHandler(TodoStorageException.class)
    public ResponseEntity<ErrorResponse> storage(TodoStorageException ex) {
        log.error("Database error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal server error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message));
    }

    public record ErrorResponse(int code, String message) {
    }
}
