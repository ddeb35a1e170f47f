package com.practice.todoapi.todo.domain.exception;

public class TodoNotFoundException extends RuntimeException {

    public TodoNotFoundException(long id) {
        super("Todo not found: " + id);
    }
}
