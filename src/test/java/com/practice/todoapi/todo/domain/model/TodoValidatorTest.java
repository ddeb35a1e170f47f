package com.practice.todoapi.todo.domain.model;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import org.junit.jupiter.api.Test;

import com.practice.todoapi.todo.domain.exception.TodoValidationException;

class TodoValidatorTest {

    @Test
    void acceptsTitleOfOneAndTwoHundredCharacters() {
        assertThatCode(() -> TodoValidator.validateNew(new NewTodo("a", null, null))).doesNotThrowAnyException();
        assertThatCode(() -> TodoValidator.validateNew(new NewTodo("x".repeat(200), null, null))).doesNotThrowAnyException();
    }

    @Test
    void rejectsEmptyBlankOrOverlongTitle() {
        assertThatThrownBy(() -> TodoValidator.validateNew(new NewTodo("", null, null)))
                .isInstanceOf(TodoValidationException.class)
                .hasMessageContaining("title must be 1..=200");
        assertThatThrownBy(() -> TodoValidator.validateNew(new NewTodo("   ", null, null)))
                .isInstanceOf(TodoValidationException.class);
        assertThatThrownBy(() -> TodoValidator.validateNew(new NewTodo("x".repeat(201), null, null)))
                .isInstanceOf(TodoValidationException.class);
        assertThatThrownBy(() -> TodoValidator.validateNew(new NewTodo(null, null, null)))
                .isInstanceOf(TodoValidationException.class);
    }

    @Test
    void countsCodePointsNotUtf16Units() {
        String emoji = "😀";
        assertThatCode(() -> TodoValidator.validateNew(new NewTodo(emoji.repeat(200), null, null)))
                .doesNotThrowAnyException();
    }

    @Test
    void descriptionLimitIsTwoThousand() {
        assertThatCode(() -> TodoValidator.validateNew(new NewTodo("ok", "d".repeat(2000), OffsetDateTime.now())))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> TodoValidator.validateNew(new NewTodo("ok", "d".repeat(2001), null)))
                .isInstanceOf(TodoValidationException.class)
                .hasMessageContaining("description");
    }

    @Test
    void updateChecksOnlyFieldsCarryingAValue() {
        assertThatCode(() -> TodoValidator.validateUpdate(UpdateTodo.empty())).doesNotThrowAnyException();
        assertThatCode(() -> TodoValidator.validateUpdate(UpdateTodo.builder()
                .title(Patch.of("New"))
                .description(Patch.clear())
                .completed(Patch.of(true))
                .dueDate(Patch.clear())
                .build())).doesNotThrowAnyException();

        assertThatThrownBy(() -> TodoValidator.validateUpdate(UpdateTodo.builder().title(Patch.of("")).build()))
                .isInstanceOf(TodoValidationException.class)
                .hasMessageContaining("title must be 1..=200");
        assertThatThrownBy(() -> TodoValidator.validateUpdate(UpdateTodo.builder().title(Patch.of("x".repeat(201))).build()))
                .isInstanceOf(TodoValidationException.class);
        assertThatThrownBy(() -> TodoValidator.validateUpdate(UpdateTodo.builder().description(Patch.of("x".repeat(2001))).build()))
                .isInstanceOf(TodoValidationException.class)
                .hasMessageContaining("description");
    }

    @Test
    void titleAndCompletedCannotBeCleared() {
        assertThatThrownBy(() -> TodoValidator.validateUpdate(UpdateTodo.builder().title(Patch.clear()).build()))
                .isInstanceOf(TodoValidationException.class)
                .hasMessage("title must not be null");
        assertThatThrownBy(() -> TodoValidator.validateUpdate(UpdateTodo.builder().completed(Patch.clear()).build()))
                .isInstanceOf(TodoValidationException.class)
                .hasMessage("completed must not be null");
    }
}
