package com.festival.api;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Конфигурация Swagger/OpenAPI
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Spring Festival Simulator API")
                .version("1.0.0")
                .description("""
                    API пошагового симулятора праздника Весны.

                    ## Возможности:
                    - Выбор персонажа и запуск прохождения
                    - События и варианты ответа с условиями
                    - Концовка с итоговым счетом
                    - Слоты сохранений, экспорт и импорт
                    """)
                .contact(new Contact()
                    .name("Spring Festival Simulator"))
                .license(new License()
                    .name("MIT")
                    .url("https://opensource.org/licenses/MIT")))
            .servers(List.of(
                new Server()
                    .url("http://localhost:8080")
                    .description("Локальный сервер")
            ));
    }
}
