package com.gas_supply_forecast.dto.forecast;

import com.gas_supply_forecast.dto.train.TrainingSummaryDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResultDTO {
    private TrainingSummaryDTO training;
    private PredictionTable table;
    // per-unit tables keyed by unit name, e.g. "M3"
    private Map<String, PredictionTable> unitTables;
}
