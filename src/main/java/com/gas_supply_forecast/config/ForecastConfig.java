package com.gas_supply_forecast.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
public class ForecastConfig {

    @Bean
    public Clock forecastClock(@Value("${forecast.timezone:Asia/Seoul}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }

    @Bean
    public RestTemplate weatherRestTemplate(RestTemplateBuilder builder,
                                            @Value("${forecast.weather.connect-timeout:5s}") Duration connectTimeout,
                                            @Value("${forecast.weather.read-timeout:10s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
