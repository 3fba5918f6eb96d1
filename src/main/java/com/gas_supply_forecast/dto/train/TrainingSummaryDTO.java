package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.CacheMissReasonEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingSummaryDTO {
    private PredictionTaskEnum task;
    private List<Integer> years;
    private List<Integer> months;
    private List<WeekdayEnum> weekdays;
    private boolean cacheHit;
    private CacheMissReasonEnum missReason;
    private int trainingRows;
    private List<ModelSummary> models;
    private Set<String> unfittedAlgorithms;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ModelSummary {
        private String algorithm;
        private String displayName;
        private String unit;
        private String column;
        private Double rmse;
        private Double mae;
        private Double rSquared;
    }
}
