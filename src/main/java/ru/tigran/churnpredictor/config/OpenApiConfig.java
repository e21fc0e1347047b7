package ru.tigran.churnpredictor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 configuration for Swagger UI documentation.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Churn Predictor API")
                        .description("Принимает NLS оценку и текст отзыва, обогащает отзыв sentiment и темами, " +
                                "считает риск оттока и сохраняет отзыв вместе с предсказанием.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Tigran")
                                .url("https://github.com/TIGERVENENO")
                        )
                );
    }
}
