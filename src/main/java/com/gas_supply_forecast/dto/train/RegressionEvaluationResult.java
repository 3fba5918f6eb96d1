package com.gas_supply_forecast.dto.train;

import lombok.Data;

/**
 * In-sample fit quality of one regressor. Values the evaluation cannot define
 * (e.g. R² on a constant target) are null.
 */
@Data
public class RegressionEvaluationResult {
    private final Double rmse;
    private final Double mae;
    private final Double rSquared;
    private final int trainingRows;
}
