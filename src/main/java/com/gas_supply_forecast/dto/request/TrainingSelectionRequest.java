package com.gas_supply_forecast.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
public class TrainingSelectionRequest {

    @Schema(description = "Years to train on. Omitted: the last three years of the dataset", example = "[2022, 2023, 2024]")
    private List<@NotNull @Min(1900) @Max(2100) Integer> years;

    @Schema(description = "Months to train on. Omitted: all months", example = "[1, 2, 12]")
    private List<@NotNull @Min(1) @Max(12) Integer> months;

    @Schema(description = "Weekdays as labels (월..일) or names (MONDAY..SUNDAY). Omitted: all weekdays", example = "[\"월\", \"화\"]")
    private List<@NotNull String> weekdays;

    @Schema(description = "Algorithm names. Omitted: every algorithm of the task", example = "[\"POLYNOMIAL\", \"KNN\"]")
    private List<@NotNull String> algorithms;

    @Schema(description = "Discard the cached models and fit again", example = "false")
    private boolean retrain;
}
