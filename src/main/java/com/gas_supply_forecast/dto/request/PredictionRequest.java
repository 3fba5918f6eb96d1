package com.gas_supply_forecast.dto.request;

import com.gas_supply_forecast.dto.forecast.ForecastRow;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {

    @Valid
    @Schema(description = "Training selection; omitted means the defaults of each field")
    private TrainingSelectionRequest selection;

    @NotNull(message = "Forecast rows are required")
    @Schema(description = "Forecast input rows in display order")
    private List<@NotNull ForecastRow> rows;
}
