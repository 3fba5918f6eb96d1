package com.gas_supply_forecast.exception;

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One or more forecast rows lack a feature value the models need, or lack a date.
 * Undated rows are reported by their 1-based position in the input.
 */
@Getter
public class MissingForecastInputException extends RuntimeException {

    private final List<LocalDate> dates;
    private final List<Integer> undatedRows;

    public MissingForecastInputException(List<LocalDate> dates) {
        this(dates, List.of());
    }

    public MissingForecastInputException(List<LocalDate> dates, List<Integer> undatedRows) {
        super(describe(dates, undatedRows));
        this.dates = List.copyOf(dates);
        this.undatedRows = List.copyOf(undatedRows);
    }

    private static String describe(List<LocalDate> dates, List<Integer> undatedRows) {
        if (dates.isEmpty() && undatedRows.isEmpty()) {
            return "Forecast input is missing feature values for every row (no rows given)";
        }
        List<String> parts = new ArrayList<>();
        if (!dates.isEmpty()) {
            parts.add("feature values for dates " + dates);
        }
        if (!undatedRows.isEmpty()) {
            parts.add("a date in rows " + undatedRows);
        }
        return "Forecast input is missing " + String.join(" and ", parts);
    }
}
