package com.practice.todoapi.todo.web.dto;

import java.time.OffsetDateTime;

import com.practice.todoapi.todo.domain.model.Todo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TodoResponse {
    Long id;
    String title;
    String description;
    boolean completed;
    OffsetDateTime dueDate;
    OffsetDateTime createdAt;
    OffsetDateTime updatedAt;

    public static TodoResponse from(Todo todo) {
        return TodoResponse.builder()
                .id(todo.getId())
                .title(todo.getTitle())
                .description(todo.getDescription())
                .completed(todo.isCompleted())
                .dueDate(todo.getDueDate())
                .createdAt(todo.getCreatedAt())
                .updatedAt(todo.getUpdatedAt())
                .build();
    }
}
