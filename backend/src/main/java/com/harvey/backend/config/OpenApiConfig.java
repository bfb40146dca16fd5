package com.harvey.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI harveyOpenApi() {
        SecurityScheme adminToken = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("X-Admin-Token");
        return new OpenAPI()
                .info(new Info()
                        .title("Harvey Ops API")
                        .description("Service self-healing and model training pipeline")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes("adminToken", adminToken));
    }
}
