package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import com.gas_supply_forecast.util.KoreanHolidayCalendar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Adds calendar attributes (year, month, day, weekday label, holiday name) to daily records.
 * Holidays are looked up in the record's own calendar year.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeatureEnrichmentService {

    private final KoreanHolidayCalendar holidayCalendar;

    public List<EnrichedRecord> enrich(List<DailyRecord> records) {
        List<EnrichedRecord> enriched = new ArrayList<>(records.size());
        for (DailyRecord record : records) {
            enriched.add(enrich(record));
        }
        log.debug("Enriched {} records", enriched.size());
        return enriched;
    }

    public EnrichedRecord enrich(DailyRecord record) {
        LocalDate date = record.date();
        return new EnrichedRecord(
                record,
                date.getYear(),
                date.getMonthValue(),
                date.getDayOfMonth(),
                WeekdayEnum.of(date.getDayOfWeek()),
                holidayCalendar.holidayName(date));
    }
}
