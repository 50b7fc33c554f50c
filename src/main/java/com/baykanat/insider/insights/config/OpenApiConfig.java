package com.baykanat.insider.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI insightsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Insider One - Insights Engine API")
                        .description("""
                                Product analytics engine over raw event streams: ordered, strict and \
                                unordered conversion funnels with exclusions and breakdowns, trends with \
                                formulas, stickiness histograms and Bayesian A/B experiment statistics.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
