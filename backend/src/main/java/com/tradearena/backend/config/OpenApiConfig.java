package com.tradearena.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tradeArenaOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Trade Arena Settlement API")
                        .description("Operator and webhook surface of the contest settlement core")
                        .version("1.0"));
    }
}
