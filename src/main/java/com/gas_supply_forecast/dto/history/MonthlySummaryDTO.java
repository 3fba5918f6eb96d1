package com.gas_supply_forecast.dto.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate of one calendar month. Averages and sums skip missing values; a column with no
 * value in the month is null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlySummaryDTO {
    private int year;
    private int month;
    private int days;
    private Double avgTemp;
    private Double supplyM3;
    private Double supplyMj;
}
