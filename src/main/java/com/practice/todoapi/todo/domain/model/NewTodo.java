package com.practice.todoapi.todo.domain.model;

import java.time.OffsetDateTime;

/**
 * Input for creating a todo. Id and timestamps are assigned by the repository.
 */
public record NewTodo(String title, String description, OffsetDateTime dueDate) {

    public NewTodo trimmed() {
        return new NewTodo(
                title == null ? null : title.strip(),
                description == null ? null : description.strip(),
                dueDate);
    }
}
