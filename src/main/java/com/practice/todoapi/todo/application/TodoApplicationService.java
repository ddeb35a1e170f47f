package com.practice.todoapi.todo.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.practice.todoapi.todo.domain.exception.TodoNotFoundException;
import com.practice.todoapi.todo.domain.model.ListQuery;
import com.practice.todoapi.todo.domain.model.NewTodo;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;
import com.practice.todoapi.todo.domain.repository.TodoRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Todo use cases. Inputs are trimmed here, a missing id becomes {@link TodoNotFoundException};
 * validation and storage exceptions from the repository pass through unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class TodoApplicationService {

    private final TodoRepository todoRepository;

    public Todo create(NewTodo newTodo) {
        Todo todo = todoRepository.create(newTodo.trimmed());
        log.info("Created todo {}", todo.getId());
        return todo;
    }

    @Transactional(readOnly = true)
    public List<Todo> list(ListQuery query) {
        return todoRepository.list(query);
    }

    @Transactional(readOnly = true)
    public Todo get(long id) {
        return todoRepository.findById(id).orElseThrow(() -> new TodoNotFoundException(id));
    }

    public Todo update(long id, UpdateTodo update) {
        if (update.isEmpty()) {
            log.debug("Empty update for todo {}, only updated_at changes", id);
        }
        Todo todo = todoRepository.update(id, update.trimmed()).orElseThrow(() -> new TodoNotFoundException(id));
        log.info("Updated todo {}", id);
        return todo;
    }

    public void delete(long id) {
        if (!todoRepository.delete(id)) {
            throw new TodoNotFoundException(id);
        }
        log.info("Deleted todo {}", id);
    }
}
