package com.gas_supply_forecast.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.exception.WeatherApiException;
import com.gas_supply_forecast.util.ValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Daily ASOS observations from the Korea Meteorological Administration open data service.
 */
@Service
@Slf4j
public class AsosWeatherClient implements WeatherObservationClient {

    static final String SUCCESS_CODE = "00";
    private static final DateTimeFormatter API_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String serviceKey;
    private final String stationId;

    public AsosWeatherClient(RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             @Value("${forecast.weather.base-url}") String baseUrl,
                             @Value("${forecast.weather.service-key:}") String serviceKey,
                             @Value("${forecast.weather.station-id:143}") String stationId) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.serviceKey = serviceKey;
        this.stationId = stationId;
    }

    @Override
    public DailyRecord fetchDaily(LocalDate date) {
        if (!ValidationUtil.stringExists(serviceKey)) {
            throw new WeatherApiException("Weather service key is not configured (forecast.weather.service-key)");
        }

        URI uri = buildUri(date);
        log.info("🌡️ Requesting ASOS observation for {} (station {})", date, stationId);

        String body;
        try {
            body = restTemplate.getForObject(uri, String.class);
        } catch (RestClientException e) {
            throw new WeatherApiException("Weather service request failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new WeatherApiException("Weather service returned an empty body");
        }
        return parse(body, date);
    }

    URI buildUri(LocalDate date) {
        String day = date.format(API_DATE);
        // the key is expanded after encode() so its '+', '/' and '=' are escaped
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("serviceKey", "{serviceKey}")
                .queryParam("pageNo", 1)
                .queryParam("numOfRows", 10)
                .queryParam("dataType", "JSON")
                .queryParam("dataCd", "ASOS")
                .queryParam("dateCd", "DAY")
                .queryParam("startDt", day)
                .queryParam("endDt", day)
                .queryParam("stnIds", stationId)
                .encode()
                .buildAndExpand(Map.of("serviceKey", serviceKey))
                .toUri();
    }

    DailyRecord parse(String body, LocalDate date) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new WeatherApiException("Weather service returned a non-JSON body", e);
        }

        JsonNode header = root.path("response").path("header");
        String resultCode = header.path("resultCode").asText("");
        if (!SUCCESS_CODE.equals(resultCode)) {
            throw new WeatherApiException("Weather service error " + resultCode + ": " + header.path("resultMsg").asText("unknown"));
        }

        JsonNode items = root.path("response").path("body").path("items").path("item");
        JsonNode match = null;
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (sameDay(item.path("tm").asText(""), date)) {
                    match = item;
                    break;
                }
            }
        } else if (items.isObject() && sameDay(items.path("tm").asText(""), date)) {
            match = items;
        }
        if (match == null) {
            throw new WeatherApiException("No ASOS observation for " + date);
        }

        DailyRecord record = DailyRecord.temperatures(date,
                number(match, "avgTa"), number(match, "minTa"), number(match, "maxTa"));
        log.info("✅ ASOS observation {}: avg={} min={} max={}", date, record.avgTemp(), record.minTemp(), record.maxTemp());
        return record;
    }

    private boolean sameDay(String tm, LocalDate date) {
        return tm.startsWith(date.toString());
    }

    private Double number(JsonNode item, String field) {
        String raw = item.path(field).asText("");
        if (ValidationUtil.isMissingCell(raw)) {
            return null;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new WeatherApiException("Invalid " + field + " value '" + raw + "' in weather response", e);
        }
    }
}
