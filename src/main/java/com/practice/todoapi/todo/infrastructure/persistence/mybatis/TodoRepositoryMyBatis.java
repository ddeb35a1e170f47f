package com.practice.todoapi.todo.infrastructure.persistence.mybatis;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.practice.todoapi.todo.domain.exception.TodoStorageException;
import com.practice.todoapi.todo.domain.model.ListQuery;
import com.practice.todoapi.todo.domain.model.NewTodo;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.TodoValidator;
import com.practice.todoapi.todo.domain.model.UpdateTodo;
import com.practice.todoapi.todo.domain.repository.TodoRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class TodoRepositoryMyBatis implements TodoRepository {

    private final TodoMapper todoMapper;
    private final Clock clock;

    @Override
    @Transactional
    public Todo create(NewTodo newTodo) {
        TodoValidator.validateNew(newTodo);
        Todo todo = new Todo(newTodo.title(), newTodo.description(), newTodo.dueDate(), now());
        try {
            todoMapper.insert(todo);
            log.debug("Inserted todo {}", todo.getId());
            return todoMapper.selectById(todo.getId());
        } catch (DataAccessException e) {
            throw new TodoStorageException("Failed to insert todo", e);
        }
    }

    @Override
    public Optional<Todo> findById(long id) {
        try {
            return Optional.ofNullable(todoMapper.selectById(id));
        } catch (DataAccessException e) {
            throw new TodoStorageException("Failed to load todo " + id, e);
        }
    }

    @Override
    public List<Todo> list(ListQuery query) {
        try {
            return todoMapper.selectPage(query.completed(), query.limitOrDefault(), query.offsetOrDefault());
        } catch (DataAccessException e) {
            throw new TodoStorageException("Failed to list todos", e);
        }
    }

    // Single UPDATE statement: the row is either fully old or fully new to other readers.
    @Override
    @Transactional
    public Optional<Todo> update(long id, UpdateTodo update) {
        TodoValidator.validateUpdate(update);
        try {
            int affected = todoMapper.update(TodoUpdateRow.of(id, update, now()));
            if (affected == 0) {
                log.debug("No todo {} to update", id);
                return Optional.empty();
            }
            return Optional.ofNullable(todoMapper.selectById(id));
        } catch (DataAccessException e) {
            throw new TodoStorageException("Failed to update todo " + id, e);
        }
    }

    @Override
    @Transactional
    public boolean delete(long id) {
        try {
            return todoMapper.deleteById(id) > 0;
        } catch (DataAccessException e) {
            throw new TodoStorageException("Failed to delete todo " + id, e);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
