package com.practice.todoapi.todo.infrastructure.persistence.mybatis;

import java.time.OffsetDateTime;

import com.practice.todoapi.todo.domain.model.UpdateTodo;

import lombok.Builder;
import lombok.Getter;

/**
 * Flattened {@link UpdateTodo} for the mapper: one {@code *Set} flag per column decides
 * whether the column appears in the SET clause.
 */
@Getter
@Builder
public class TodoUpdateRow {
    private final long id;
    private final OffsetDateTime updatedAt;
    private final boolean titleSet;
    private final String title;
    private final boolean descriptionSet;
    private final String description;
    private final boolean completedSet;
    private final Boolean completed;
    private final boolean dueDateSet;
    private final OffsetDateTime dueDate;

    public static TodoUpdateRow of(long id, UpdateTodo update, OffsetDateTime now) {
        return TodoUpdateRow.builder()
                .id(id)
                .updatedAt(now)
                .titleSet(update.title().isPresent())
                .title(update.title().value())
                .descriptionSet(update.description().isPresent())
                .description(update.description().value())
                .completedSet(update.completed().isPresent())
                .completed(update.completed().value())
                .dueDateSet(update.dueDate().isPresent())
                .dueDate(update.dueDate().value())
                .build();
    }
}
