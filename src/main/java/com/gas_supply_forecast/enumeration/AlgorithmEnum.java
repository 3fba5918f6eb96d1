package com.gas_supply_forecast.enumeration;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Regressor families offered to the operator. The display name is the label the
 * operator screens use; both the constant name and the display name are accepted on input.
 */
public enum AlgorithmEnum {
    LINEAR("선형회귀"),
    POLYNOMIAL("다항회귀"),
    RANDOM_FOREST("랜덤포레스트"),
    KNN("KNN"),
    DECISION_TREE("결정트리"),
    GRADIENT_BOOSTING("그레디언트부스팅");

    private final String displayName;

    AlgorithmEnum(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<AlgorithmEnum> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        return Arrays.stream(values())
                .filter(a -> a.name().equals(normalized) || a.displayName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public static String normalize(String name) {
        return name.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
    }
}
