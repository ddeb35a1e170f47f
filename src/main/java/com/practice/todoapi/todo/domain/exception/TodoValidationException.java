package com.practice.todoapi.todo.domain.exception;

/**
 * Input violates a field constraint. Raised before anything reaches storage.
 */
public class TodoValidationException extends RuntimeException {

    public TodoValidationException(String message) {
        super(message);
    }
}
