package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.history.MonthlySummaryDTO;
import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Read-only views of the historical dataset for exploratory tables.
 */
@Service
@RequiredArgsConstructor
public class HistoryService {

    private final DatasetService datasetService;
    private final FeatureEnrichmentService featureEnrichmentService;

    /**
     * Enriched records matching the filters. A null filter matches everything.
     */
    public List<EnrichedRecord> dailyRecords(Collection<Integer> years, Collection<Integer> months,
                                             Collection<WeekdayEnum> weekdays) {
        return featureEnrichmentService.enrich(datasetService.getRecords()).stream()
                .filter(r -> years == null || years.contains(r.year()))
                .filter(r -> months == null || months.contains(r.month()))
                .filter(r -> weekdays == null || weekdays.contains(r.weekday()))
                .toList();
    }

    /**
     * Mean average temperature and summed supply per (year, month), in calendar order.
     */
    public List<MonthlySummaryDTO> monthlySummary(Collection<Integer> years, Collection<Integer> months) {
        Map<Integer, List<EnrichedRecord>> byMonth = new TreeMap<>();
        for (EnrichedRecord record : dailyRecords(years, months, null)) {
            byMonth.computeIfAbsent(record.year() * 100 + record.month(), k -> new ArrayList<>()).add(record);
        }

        List<MonthlySummaryDTO> summaries = new ArrayList<>();
        byMonth.forEach((key, records) -> summaries.add(MonthlySummaryDTO.builder()
                .year(key / 100)
                .month(key % 100)
                .days(records.size())
                .avgTemp(mean(records, r -> r.record().avgTemp()))
                .supplyM3(sum(records, r -> r.record().supplyM3()))
                .supplyMj(sum(records, r -> r.record().supplyMj()))
                .build()));
        return summaries;
    }

    private Double mean(List<EnrichedRecord> records, Function<EnrichedRecord, Double> column) {
        double total = 0;
        int count = 0;
        for (EnrichedRecord record : records) {
            Double value = column.apply(record);
            if (value != null && !value.isNaN()) {
                total += value;
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private Double sum(List<EnrichedRecord> records, Function<EnrichedRecord, Double> column) {
        double total = 0;
        boolean any = false;
        for (EnrichedRecord record : records) {
            Double value = column.apply(record);
            if (value != null && !value.isNaN()) {
                total += value;
                any = true;
            }
        }
        return any ? total : null;
    }
}
