package com.gas_supply_forecast.util;

import java.util.Set;

public class ValidationUtil {

    private static final Set<String> MISSING_MARKERS = Set.of("", "na", "nan", "null", "?", "-");

    public static boolean stringExists(String str) {
        return str != null && !str.isBlank();
    }

    public static boolean isMissingCell(String cell) {
        return cell == null || MISSING_MARKERS.contains(cell.trim().toLowerCase());
    }
}
