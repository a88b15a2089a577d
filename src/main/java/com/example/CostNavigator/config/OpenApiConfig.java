package com.example.CostNavigator.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "CostNavigator API",
                version = "v1",
                description = "Hospital procedure cost and rating search by DRG code or plain-language question"
        )
)
public class OpenApiConfig {
}
