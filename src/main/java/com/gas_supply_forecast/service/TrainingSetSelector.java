package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class TrainingSetSelector {

    /**
     * Rows whose year, month and weekday are all selected. An empty component selects nothing.
     */
    public List<EnrichedRecord> filter(List<EnrichedRecord> records, TrainingSelection selection) {
        return records.stream()
                .filter(r -> selection.years().contains(r.year()))
                .filter(r -> selection.months().contains(r.month()))
                .filter(r -> selection.weekdays().contains(r.weekday()))
                .toList();
    }

    /**
     * Training set of a task: filtered rows that carry every column the task needs.
     * Rows with a missing value are dropped, never imputed.
     */
    public List<EnrichedRecord> select(List<EnrichedRecord> records, TrainingSelection selection, PredictionTaskEnum task) {
        List<EnrichedRecord> filtered = filter(records, selection);
        List<String> required = task.getRequiredColumns();
        List<EnrichedRecord> complete = filtered.stream()
                .filter(r -> r.hasValues(required))
                .toList();

        log.info("🧮 {} training set: {} of {} rows match the selection, {} complete",
                task, filtered.size(), records.size(), complete.size());
        return complete;
    }
}
