package com.baykanat.energy.meter.config;

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
    public OpenAPI meterAnalyticsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Meter Analytics - Readings, Usage Patterns & Tariff Costs API")
                        .description("""
                                Serves electricity meter readings synced every 15 minutes from the upstream \
                                meter feeds, with hourly/daily/weekly aggregation, usage patterns, a 24x7 \
                                heatmap and a dual-tariff (peak / off-peak) cost breakdown.\
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
