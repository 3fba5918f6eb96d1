package com.gas_supply_forecast.controller;

import com.gas_supply_forecast.dto.ingestion.IngestionResult;
import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.dto.response.GenericResponse;
import com.gas_supply_forecast.service.WeatherIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/ingestion")
@Slf4j
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "Ingestion", description = "Daily weather observation import")
public class IngestionController {

    private final WeatherIngestionService weatherIngestionService;

    @Operation(summary = "Import one day's observation into the dataset",
            description = "Defaults to yesterday. A date already in the dataset is left untouched.")
    @PostMapping("/run")
    public ResponseEntity<GenericResponse<IngestionResult>> run(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        IngestionResult result = date == null
                ? weatherIngestionService.ingestYesterday()
                : weatherIngestionService.ingest(date);
        log.info("Manual ingestion for {}: {}", result.date(), result.status());
        return ResponseEntity.ok(GenericResponse.success(result.message(), result));
    }

    @Operation(summary = "Fetch one day's observation without storing it")
    @GetMapping("/observation")
    public ResponseEntity<GenericResponse<DailyRecord>> observation(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(GenericResponse.success("Observation for " + date, weatherIngestionService.preview(date)));
    }
}
