package com.practice.todoapi.todo.domain.model;

import com.practice.todoapi.todo.domain.exception.TodoValidationException;

/**
 * Field constraints shared by every repository implementation.
 * Lengths are counted in code points; the title is measured without surrounding whitespace.
 */
public final class TodoValidator {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;

    private TodoValidator() {
    }

    public static void validateNew(NewTodo newTodo) {
        checkTitle(newTodo.title());
        checkDescription(newTodo.description());
    }

    public static void validateUpdate(UpdateTodo update) {
        if (update.title().isCleared()) {
            throw new TodoValidationException("title must not be null");
        }
        if (update.completed().isCleared()) {
            throw new TodoValidationException("completed must not be null");
        }
        if (update.title().hasValue()) {
            checkTitle(update.title().value());
        }
        if (update.description().hasValue()) {
            checkDescription(update.description().value());
        }
    }

    private static void checkTitle(String title) {
        int length = title == null ? 0 : codePoints(title.strip());
        if (length == 0 || length > MAX_TITLE_LENGTH) {
            throw new TodoValidationException("title must be 1..=" + MAX_TITLE_LENGTH + " characters");
        }
    }

    private static void checkDescription(String description) {
        if (description != null && codePoints(description) > MAX_DESCRIPTION_LENGTH) {
            throw new TodoValidationException("description must be <= " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }

    private static int codePoints(String s) {
        return s.codePointCount(0, s.length());
    }
}
