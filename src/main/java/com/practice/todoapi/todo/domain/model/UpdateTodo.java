package com.practice.todoapi.todo.domain.model;

import java.time.OffsetDateTime;

import lombok.Builder;

/**
 * Partial update of a todo. Each field is a {@link Patch}: absent fields are left untouched,
 * cleared fields are set to {@code null}, valued fields overwrite the stored value.
 * {@code title} and {@code completed} must never be cleared.
 */
@Builder
public record UpdateTodo(
        Patch<String> title,
        Patch<String> description,
        Patch<Boolean> completed,
        Patch<OffsetDateTime> dueDate
) {

    public UpdateTodo {
        title = title == null ? Patch.absent() : title;
        description = description == null ? Patch.absent() : description;
        completed = completed == null ? Patch.absent() : completed;
        dueDate = dueDate == null ? Patch.absent() : dueDate;
    }

    public static UpdateTodo empty() {
        return UpdateTodo.builder().build();
    }

    public UpdateTodo trimmed() {
        return new UpdateTodo(title.map(String::strip), description.map(String::strip), completed, dueDate);
    }

    public boolean isEmpty() {
        return !title.isPresent() && !description.isPresent() && !completed.isPresent() && !dueDate.isPresent();
    }
}
