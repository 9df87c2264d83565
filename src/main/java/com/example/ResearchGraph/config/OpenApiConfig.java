package com.example.ResearchGraph.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "ResearchGraph API",
                version = "v1",
                description = "Cached question answering over individual research papers"
        )
)
public class OpenApiConfig {
}
