package com.practice.todoapi.todo.domain.model;

import java.time.OffsetDateTime;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@ToString
public class Todo {
    private Long id;
    private String title;
    private String description;
    private boolean completed;
    private OffsetDateTime dueDate;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public Todo(String title, String description, OffsetDateTime dueDate, OffsetDateTime now) {
        this.title = title;
        this.description = description;
        this.dueDate = dueDate;
        this.completed = false;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Applies every present field of the update and moves {@code updatedAt} to {@code now}.
     * Fields left absent keep their current value.
     */
    public void apply(UpdateTodo update, OffsetDateTime now) {
        this.title = update.title().applyTo(this.title);
        this.description = update.description().applyTo(this.description);
        this.completed = update.completed().applyTo(this.completed);
        this.dueDate = update.dueDate().applyTo(this.dueDate);
        touch(now);
    }

    private void touch(OffsetDateTime now) {
        this.updatedAt = now.isBefore(this.createdAt) ? this.createdAt : now;
    }
}
