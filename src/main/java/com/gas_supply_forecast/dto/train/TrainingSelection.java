package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.WeekdayEnum;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Operator's choice of years, months, weekdays and algorithms for a training run.
 * Components are sets, so two selections are equal regardless of the order the
 * values were picked in. An empty component matches nothing.
 */
public record TrainingSelection(
        Set<Integer> years,
        Set<Integer> months,
        Set<WeekdayEnum> weekdays,
        Set<String> algorithms
) {

    public TrainingSelection {
        years = years == null ? Set.of() : Set.copyOf(years);
        months = months == null ? Set.of() : Set.copyOf(months);
        weekdays = weekdays == null ? Set.of() : Set.copyOf(weekdays);
        algorithms = algorithms == null ? Set.of() : algorithms.stream()
                .map(AlgorithmEnum::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static TrainingSelection of(Collection<Integer> years, Collection<Integer> months,
                                       Collection<WeekdayEnum> weekdays, Collection<String> algorithms) {
        return new TrainingSelection(Set.copyOf(years), Set.copyOf(months), Set.copyOf(weekdays), Set.copyOf(algorithms));
    }

    /**
     * Same filters, different algorithm set.
     */
    public TrainingSelection withAlgorithms(Collection<String> newAlgorithms) {
        return new TrainingSelection(years, months, weekdays, Set.copyOf(newAlgorithms));
    }
}
