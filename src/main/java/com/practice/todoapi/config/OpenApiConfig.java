package com.practice.todoapi.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI todoOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Todo API")
                        .version("v1")
                        .description("Create, read, update, delete and list todo items"))
                .tags(List.of(
                        new Tag().name("todos").description("Todo management endpoints"),
                        new Tag().name("health").description("Health check")));
    }
}
