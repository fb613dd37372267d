package com.example.PolicyDesk.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "PolicyDesk API",
                version = "v1",
                description = "Grounded question answering over the HR policy handbook"
        )
)
public class OpenApiConfig {
}
