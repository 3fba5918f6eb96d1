package com.gas_supply_forecast.util;

import com.gas_supply_forecast.dto.request.TrainingSelectionRequest;
import com.gas_supply_forecast.dto.train.FittedModel;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.TrainingOutcome;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.dto.train.TrainingSummaryDTO;
import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import com.gas_supply_forecast.exception.BadRequestException;
import com.gas_supply_forecast.exception.UnsupportedAlgorithmException;
import com.gas_supply_forecast.service.DatasetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.IntStream;

@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingHelper {

    static final int DEFAULT_YEAR_COUNT = 3;

    private final DatasetService datasetService;

    /**
     * Turns a request into a training selection. Omitted fields take their defaults: the last
     * three years of the dataset, every month, every weekday and every algorithm of the task.
     * Names that match no algorithm are kept so the later model lookup can report them.
     *
     * @throws UnsupportedAlgorithmException if a known algorithm is not offered for the task
     * @throws BadRequestException           if a weekday label is not recognised
     */
    public TrainingSelection toSelection(TrainingSelectionRequest request, PredictionTaskEnum task) {
        TrainingSelectionRequest source = request == null ? new TrainingSelectionRequest() : request;

        List<Integer> years = source.getYears() != null ? source.getYears() : defaultYears();
        List<Integer> months = source.getMonths() != null
                ? source.getMonths()
                : IntStream.rangeClosed(1, 12).boxed().toList();

        Set<WeekdayEnum> weekdays = new LinkedHashSet<>();
        if (source.getWeekdays() == null) {
            weekdays.addAll(Arrays.asList(WeekdayEnum.values()));
        } else {
            for (String label : source.getWeekdays()) {
                weekdays.add(WeekdayEnum.fromLabel(label)
                        .orElseThrow(() -> new BadRequestException("Unknown weekday: " + label)));
            }
        }

        List<String> algorithms = new ArrayList<>();
        if (source.getAlgorithms() == null) {
            task.getAlgorithms().forEach(a -> algorithms.add(a.name()));
        } else {
            for (String name : source.getAlgorithms()) {
                Optional<AlgorithmEnum> algorithm = AlgorithmEnum.fromName(name);
                if (algorithm.isPresent() && !task.supports(algorithm.get())) {
                    throw new UnsupportedAlgorithmException(
                            "Algorithm " + algorithm.get() + " is not offered for " + task + "; choose from " + task.getAlgorithms());
                }
                if (algorithm.isEmpty()) {
                    log.warn("⚠️ Unknown algorithm name '{}' requested for {}", name, task);
                }
                // canonical name so "랜덤포레스트" and "RANDOM_FOREST" select the same cache entry
                algorithms.add(algorithm.map(Enum::name).orElse(name));
            }
        }

        return TrainingSelection.of(years, months, weekdays, algorithms);
    }

    public TrainingSummaryDTO toSummary(TrainingOutcome outcome) {
        ModelSet modelSet = outcome.modelSet();
        TrainingSelection selection = modelSet.selection();

        List<TrainingSummaryDTO.ModelSummary> models = modelSet.all().stream()
                .map(this::toModelSummary)
                .toList();

        return TrainingSummaryDTO.builder()
                .task(modelSet.task())
                .years(selection.years().stream().sorted().toList())
                .months(selection.months().stream().sorted().toList())
                .weekdays(selection.weekdays().stream().sorted(Comparator.naturalOrder()).toList())
                .cacheHit(outcome.cacheHit())
                .missReason(outcome.missReason())
                .trainingRows(modelSet.trainingRows())
                .models(models)
                .unfittedAlgorithms(modelSet.unfittedAlgorithms())
                .build();
    }

    private TrainingSummaryDTO.ModelSummary toModelSummary(FittedModel model) {
        return new TrainingSummaryDTO.ModelSummary(
                model.algorithm().name(),
                model.algorithm().getDisplayName(),
                model.unit().name(),
                model.unit().predictionColumn(model.algorithm()),
                model.evaluation().getRmse(),
                model.evaluation().getMae(),
                model.evaluation().getRSquared());
    }

    private List<Integer> defaultYears() {
        SortedSet<Integer> available = datasetService.availableYears();
        List<Integer> years = new ArrayList<>(available);
        return years.subList(Math.max(0, years.size() - DEFAULT_YEAR_COUNT), years.size());
    }
}
