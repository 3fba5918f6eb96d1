package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.ingestion.IngestionResult;
import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.enumeration.IngestionStatusEnum;
import com.gas_supply_forecast.exception.WeatherApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Appends the previous day's observed temperatures to the dataset once per day.
 * A date already present is never written twice. Upstream failures skip the run.
 */
@Service
@Slf4j
public class WeatherIngestionService {

    private final WeatherObservationClient weatherClient;
    private final DatasetService datasetService;
    private final Clock clock;
    private final boolean enabled;

    public WeatherIngestionService(WeatherObservationClient weatherClient,
                                   DatasetService datasetService,
                                   Clock clock,
                                   @Value("${forecast.weather.enabled:false}") boolean enabled) {
        this.weatherClient = weatherClient;
        this.datasetService = datasetService;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Scheduled(cron = "${forecast.weather.cron}", zone = "${forecast.timezone}")
    public void scheduledIngestion() {
        if (!enabled) {
            log.debug("Scheduled weather ingestion is disabled");
            return;
        }
        ingestYesterday();
    }

    public IngestionResult ingestYesterday() {
        return ingest(LocalDate.now(clock).minusDays(1));
    }

    public IngestionResult ingest(LocalDate date) {
        if (datasetService.containsDate(date)) {
            log.info("ℹ️ Observation for {} already in dataset; skipping", date);
            return new IngestionResult(date, IngestionStatusEnum.ALREADY_PRESENT, "Date already present in dataset");
        }

        DailyRecord observation;
        try {
            observation = weatherClient.fetchDaily(date);
        } catch (WeatherApiException e) {
            log.warn("⚠️ Weather ingestion for {} skipped: {}", date, e.getMessage());
            return new IngestionResult(date, IngestionStatusEnum.SKIPPED_UPSTREAM_FAILURE, e.getMessage());
        }

        boolean appended = datasetService.appendIfAbsent(observation);
        if (!appended) {
            return new IngestionResult(date, IngestionStatusEnum.ALREADY_PRESENT, "Date already present in dataset");
        }
        return new IngestionResult(date, IngestionStatusEnum.APPENDED, "Observation appended");
    }

    public DailyRecord preview(LocalDate date) {
        return weatherClient.fetchDaily(date);
    }
}
