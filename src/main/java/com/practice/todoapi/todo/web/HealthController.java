package com.practice.todoapi.todo.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@Tag(name = "health")
public class HealthController {

    @GetMapping("/api/v1/health")
    @Operation(summary = "Liveness check")
    public String health() {
        return "OK";
    }
}
