package com.cardparser.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cardParserOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Card Statement Parser API")
                        .description("Detects the issuing bank of a credit card statement and extracts "
                                + "card holder, last 4 digits, billing cycle, payment due date and total amount due.")
                        .version("v1")
                        .license(new License().name("MIT")));
    }
}
