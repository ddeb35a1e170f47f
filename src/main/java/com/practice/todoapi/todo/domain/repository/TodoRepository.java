package com.practice.todoapi.todo.domain.repository;

import java.util.List;
import java.util.Optional;

import com.practice.todoapi.todo.domain.model.ListQuery;
import com.practice.todoapi.todo.domain.model.NewTodo;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;

/**
 * The only gateway to persisted todos.
 *
 * <p>Implementations validate their input with {@link com.practice.todoapi.todo.domain.model.TodoValidator}
 * and report a missing id as an empty result, never as an exception. Storage failures surface as
 * {@link com.practice.todoapi.todo.domain.exception.TodoStorageException}.
 */
public interface TodoRepository {

    Todo create(NewTodo newTodo);

    Optional<Todo> findById(long id);

    /** Ordered by id ascending. */
    List<Todo> list(ListQuery query);

    /** Empty when no todo has the given id. */
    Optional<Todo> update(long id, UpdateTodo update);

    /** False when no todo has the given id. */
    boolean delete(long id);
}
