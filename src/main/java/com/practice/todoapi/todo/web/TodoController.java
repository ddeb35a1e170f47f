package com.practice.todoapi.todo.web;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.practice.todoapi.todo.application.TodoApplicationService;
import com.practice.todoapi.todo.domain.model.ListQuery;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.web.dto.TodoRequest;
import com.practice.todoapi.todo.web.dto.TodoResponse;
import com.practice.todoapi.todo.web.dto.TodoUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/v1/todos")
@RequiredArgsConstructor
@Tag(name = "todos")
public class TodoController {

    private final TodoApplicationService service;

    @GetMapping
    @Operation(summary = "List todos ordered by id")
    @ApiResponse(responseCode = "200", description = "List of todos")
    public List<TodoResponse> list(
            @Parameter(description = "Max items, 1..200, default 50") @RequestParam(name = "limit", required = false) Integer limit,
            @Parameter(description = "Items to skip, default 0") @RequestParam(name = "offset", required = false) Integer offset,
            @Parameter(description = "Filter by completion state") @RequestParam(name = "completed", required = false) Boolean completed) {
        return service.list(new ListQuery(limit, offset, completed)).stream().map(TodoResponse::from).toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a todo")
    @ApiResponse(responseCode = "200", description = "Todo found")
    @ApiResponse(responseCode = "404", description = "Todo not found")
    public TodoResponse get(@PathVariable("id") long id) {
        Todo todo = service.get(id);
        return TodoResponse.from(todo);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a todo")
    @ApiResponse(responseCode = "201", description = "Todo created")
    @ApiResponse(responseCode = "422", description = "Validation error")
    public TodoResponse create(@Valid @RequestBody TodoRequest req) {
        Todo todo = service.create(req.toNewTodo());
        return TodoResponse.from(todo);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Partially update a todo")
    @ApiResponse(responseCode = "200", description = "Todo updated")
    @ApiResponse(responseCode = "404", description = "Todo not found")
    @ApiResponse(responseCode = "422", description = "Validation error")
    public TodoResponse update(@PathVariable("id") long id, @RequestBody TodoUpdateRequest req) {
        Todo todo = service.update(id, req.toUpdateTodo());
        return TodoResponse.from(todo);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a todo")
    @ApiResponse(responseCode = "204", description = "Todo deleted")
    @ApiResponse(responseCode = "404", description = "Todo not found")
    public void delete(@PathVariable("id") long id) {
        service.delete(id);
    }
}
