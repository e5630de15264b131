package com.noi.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI noiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("NOI Extraction API")
                        .description("Turns operating statements (PDF, Excel, CSV, text) into normalized NOI metrics.")
                        .version("v1")
                        .license(new License().name("Proprietary"))
                );
    }
}
