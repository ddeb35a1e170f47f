package com.practice.todoapi.todo.domain.exception;

/**
 * The storage engine failed (I/O, constraint violation, connection problem).
 * Not recoverable by the caller.
 */
public class TodoStorageException extends RuntimeException {

    public TodoStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
