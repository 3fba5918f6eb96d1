package com.gas_supply_forecast.dto.record;

import com.gas_supply_forecast.enumeration.WeekdayEnum;

import java.time.LocalDate;
import java.util.List;

public record EnrichedRecord(
        DailyRecord record,
        int year,
        int month,
        int day,
        WeekdayEnum weekday,
        String holiday
) {

    public LocalDate date() {
        return record.date();
    }

    public Double value(String column) {
        return record.value(column);
    }

    public boolean hasHoliday() {
        return !holiday.isEmpty();
    }

    public boolean hasValues(List<String> columns) {
        for (String column : columns) {
            Double value = record.value(column);
            if (value == null || value.isNaN()) {
                return false;
            }
        }
        return true;
    }
}
