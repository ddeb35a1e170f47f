package com.practice.todoapi.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.practice.todoapi.todo.domain.model.Patch;
import com.practice.todoapi.todo.web.json.PatchDeserializer;

@Configuration
public class JacksonConfig {

    /** Picked up by Spring Boot's auto-configured ObjectMapper. */
    @Bean
    public Module patchModule() {
        SimpleModule module = new SimpleModule("todo-patch");
        module.addDeserializer(Patch.class, new PatchDeserializer());
        return module;
    }
}
