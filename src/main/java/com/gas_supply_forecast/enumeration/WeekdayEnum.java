package com.gas_supply_forecast.enumeration;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Optional;

public enum WeekdayEnum {
    MONDAY("월"),
    TUESDAY("화"),
    WEDNESDAY("수"),
    THURSDAY("목"),
    FRIDAY("금"),
    SATURDAY("토"),
    SUNDAY("일");

    private final String label;

    WeekdayEnum(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static WeekdayEnum of(DayOfWeek dayOfWeek) {
        return values()[dayOfWeek.getValue() - 1];
    }

    /**
     * Accepts either the local label ("월") or the constant name ("MONDAY", "monday").
     */
    public static Optional<WeekdayEnum> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(w -> w.label.equals(trimmed) || w.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
