package com.practice.todoapi.todo.web.dto;

import java.time.OffsetDateTime;

import com.practice.todoapi.todo.domain.model.Patch;
import com.practice.todoapi.todo.domain.model.UpdateTodo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * Partial update. Omitted keys leave the stored value alone; {@code null} clears
 * {@code description} and {@code due_date}.
 */
@Data
@Schema(description = "Partial update of a todo; omitted fields are left unchanged")
public class TodoUpdateRequest {
    @Schema(implementation = String.class, description = "1 to 200 characters")
    private Patch<String> title = Patch.absent();

    @Schema(implementation = String.class, nullable = true, description = "Up to 2000 characters; null clears it")
    private Patch<String> description = Patch.absent();

    @Schema(implementation = Boolean.class)
    private Patch<Boolean> completed = Patch.absent();

    @Schema(implementation = OffsetDateTime.class, nullable = true, description = "RFC3339 timestamp; null clears it")
    private Patch<OffsetDateTime> dueDate = Patch.absent();

    public UpdateTodo toUpdateTodo() {
        return new UpdateTodo(title, description, completed, dueDate);
    }
}
