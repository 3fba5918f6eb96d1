package com.gas_supply_forecast.controller;

import com.gas_supply_forecast.dto.forecast.ForecastRow;
import com.gas_supply_forecast.dto.forecast.PredictionResultDTO;
import com.gas_supply_forecast.dto.request.PredictionRequest;
import com.gas_supply_forecast.dto.request.TrainingSelectionRequest;
import com.gas_supply_forecast.dto.response.GenericResponse;
import com.gas_supply_forecast.dto.train.AlgorithmDTO;
import com.gas_supply_forecast.dto.train.TrainingOutcome;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.dto.train.TrainingSummaryDTO;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.service.ForecastInputService;
import com.gas_supply_forecast.service.ModelCacheService;
import com.gas_supply_forecast.service.PredictionService;
import com.gas_supply_forecast.util.TrainingHelper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/forecast")
@Slf4j
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "Forecast", description = "Train supply/temperature regressors and predict from operator forecasts")
public class ForecastController {

    private final ModelCacheService modelCacheService;
    private final PredictionService predictionService;
    private final ForecastInputService forecastInputService;
    private final TrainingHelper trainingHelper;

    @Operation(summary = "List the algorithms offered for a task")
    @GetMapping("/algorithms")
    public ResponseEntity<GenericResponse<List<AlgorithmDTO>>> algorithms(@RequestParam PredictionTaskEnum task) {
        List<AlgorithmDTO> algorithms = task.getAlgorithms().stream()
                .map(a -> new AlgorithmDTO(a.name(), a.getDisplayName(),
                        task.getTargetUnits().stream().map(u -> u.predictionColumn(a)).toList()))
                .toList();
        return ResponseEntity.ok(GenericResponse.success("Algorithms for " + task, algorithms));
    }

    @Operation(summary = "Train models for a selection",
            description = "Reuses the cached models when the selection is unchanged and no retrain is requested.")
    @PostMapping("/train")
    public ResponseEntity<GenericResponse<TrainingSummaryDTO>> train(
            @RequestParam PredictionTaskEnum task,
            @Valid @RequestBody(required = false) TrainingSelectionRequest request) {
        TrainingSelection selection = trainingHelper.toSelection(request, task);
        boolean retrain = request != null && request.isRetrain();
        TrainingOutcome outcome = modelCacheService.ensureTrained(task, selection, retrain);

        String message = outcome.cacheHit() ? "Cached models reused" : "Models trained (" + outcome.missReason() + ")";
        return ResponseEntity.ok(GenericResponse.success(message, trainingHelper.toSummary(outcome)));
    }

    @Operation(summary = "Drop the cached models of a task")
    @DeleteMapping("/models")
    public ResponseEntity<GenericResponse<Void>> invalidate(@RequestParam PredictionTaskEnum task) {
        modelCacheService.invalidate(task);
        return ResponseEntity.ok(GenericResponse.success("Model cache cleared for " + task, null));
    }

    @Operation(summary = "Empty forecast input table",
            description = "One row per date from start to end inclusive. Defaults: today through the end of the month.")
    @GetMapping("/forecast-input")
    public ResponseEntity<GenericResponse<List<ForecastRow>>> forecastInput(
            @Parameter(description = "First date (yyyy-MM-dd)") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @Parameter(description = "Last date (yyyy-MM-dd)") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        List<ForecastRow> rows = forecastInputService.template(start, end);
        return ResponseEntity.ok(GenericResponse.success("Forecast input template", rows));
    }

    @Operation(summary = "Predict daily supply (m³ and MJ) from forecast average temperatures")
    @PostMapping("/predict/supply")
    public ResponseEntity<GenericResponse<PredictionResultDTO>> predictSupply(@Valid @RequestBody PredictionRequest request) {
        PredictionResultDTO result = predictionService.predict(PredictionTaskEnum.SUPPLY, request);
        return ResponseEntity.ok(GenericResponse.success("Supply prediction completed", result));
    }

    @Operation(summary = "Predict daily average temperature from forecast max/min temperatures")
    @PostMapping("/predict/temperature")
    public ResponseEntity<GenericResponse<PredictionResultDTO>> predictTemperature(@Valid @RequestBody PredictionRequest request) {
        PredictionResultDTO result = predictionService.predict(PredictionTaskEnum.TEMPERATURE, request);
        return ResponseEntity.ok(GenericResponse.success("Temperature prediction completed", result));
    }
}
