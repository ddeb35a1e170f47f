package com.practice.todoapi.todo.web.dto;

import java.time.OffsetDateTime;

import com.practice.todoapi.todo.domain.model.NewTodo;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "Payload for creating a todo")
public class TodoRequest {
    @NotNull
    @Schema(description = "1 to 200 characters", example = "Buy milk", requiredMode = Schema.RequiredMode.REQUIRED)
    private String title;

    @Schema(description = "Up to 2000 characters")
    private String description;

    @Schema(description = "RFC3339 timestamp", example = "2025-01-02T03:04:05Z")
    private OffsetDateTime dueDate;

    public NewTodo toNewTodo() {
        return new NewTodo(title, description, dueDate);
    }
}
