package com.gas_supply_forecast.dto.forecast;

import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row per forecast date, in forecast order, with one column per (algorithm, unit).
 */
public record PredictionTable(
        PredictionTaskEnum task,
        List<String> featureColumns,
        List<String> predictionColumns,
        List<PredictionRow> rows
) {

    public PredictionTable {
        featureColumns = List.copyOf(featureColumns);
        predictionColumns = List.copyOf(predictionColumns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /**
     * Same rows restricted to the columns of one unit, e.g. the m³ table of a supply forecast.
     */
    public PredictionTable unitView(TargetUnitEnum unit) {
        String suffix = "_" + unit.name();
        List<String> columns = predictionColumns.stream().filter(c -> c.endsWith(suffix)).toList();

        List<PredictionRow> viewRows = new ArrayList<>(rows.size());
        for (PredictionRow row : rows) {
            Map<String, Number> values = new LinkedHashMap<>();
            for (String column : columns) {
                values.put(column, row.predictions().get(column));
            }
            viewRows.add(new PredictionRow(row.date(), row.features(), values));
        }
        return new PredictionTable(task, featureColumns, columns, viewRows);
    }
}
