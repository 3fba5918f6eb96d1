package com.gas_supply_forecast.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Internal column naming scheme of the daily dataset and the header aliases
 * accepted from source files.
 */
public final class DatasetColumns {

    public static final String DATE = "date";
    public static final String AVG_TEMP = "avg_temp";
    public static final String MIN_TEMP = "min_temp";
    public static final String MAX_TEMP = "max_temp";
    public static final String SUPPLY_M3 = "supply_m3";
    public static final String SUPPLY_MJ = "supply_mj";

    public static final List<String> ALL = List.of(DATE, AVG_TEMP, MIN_TEMP, MAX_TEMP, SUPPLY_M3, SUPPLY_MJ);

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("date", DATE),
            Map.entry("날짜", DATE),
            Map.entry("일자", DATE),
            Map.entry("tm", DATE),
            Map.entry("avg_temp", AVG_TEMP),
            Map.entry("평균기온", AVG_TEMP),
            Map.entry("평균기온(℃)", AVG_TEMP),
            Map.entry("avgta", AVG_TEMP),
            Map.entry("min_temp", MIN_TEMP),
            Map.entry("최저기온", MIN_TEMP),
            Map.entry("최저기온(℃)", MIN_TEMP),
            Map.entry("minta", MIN_TEMP),
            Map.entry("max_temp", MAX_TEMP),
            Map.entry("최고기온", MAX_TEMP),
            Map.entry("최고기온(℃)", MAX_TEMP),
            Map.entry("maxta", MAX_TEMP),
            Map.entry("supply_m3", SUPPLY_M3),
            Map.entry("공급량(m3)", SUPPLY_M3),
            Map.entry("공급량_m3", SUPPLY_M3),
            Map.entry("supply_mj", SUPPLY_MJ),
            Map.entry("공급량(mj)", SUPPLY_MJ),
            Map.entry("공급량_mj", SUPPLY_MJ)
    );

    private DatasetColumns() {
    }

    public static Optional<String> normalize(String header) {
        if (header == null) {
            return Optional.empty();
        }
        // Excel exports often start with a BOM
        String key = header.replace("﻿", "").trim().toLowerCase(Locale.ROOT);
        return Optional.ofNullable(ALIASES.get(key));
    }
}
