package com.gas_supply_forecast.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI gasSupplyForecastOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Gas Supply Forecast API")
                        .version("1.0.0")
                        .description("Train regressors on historical weather and supply records, then predict "
                                + "daily gas supply (m³, MJ) and average temperature from operator forecasts."))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local server")
                ));
    }

    @Bean
    public GroupedOpenApi forecastApi() {
        return GroupedOpenApi.builder()
                .group("Forecast APIs")
                .pathsToMatch("/api/**")
                .build();
    }
}
