package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.forecast.ForecastRow;
import com.gas_supply_forecast.exception.InvalidDateRangeException;
import com.gas_supply_forecast.util.DateUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the empty forecast table the operator fills in before asking for predictions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForecastInputService {

    private final Clock clock;
    private final DateUtil dateUtil;

    /**
     * One empty row per date of {@code [start, end]}. A missing start means today; a missing
     * end means the last day of the start's month.
     *
     * @throws InvalidDateRangeException if start is after end; no row is built
     */
    public List<ForecastRow> template(LocalDate start, LocalDate end) {
        LocalDate from = start != null ? start : LocalDate.now(clock);
        LocalDate to = end != null ? end : dateUtil.lastDayOfMonth(from);
        if (from.isAfter(to)) {
            throw new InvalidDateRangeException("Start date " + from + " is after end date " + to);
        }

        List<ForecastRow> rows = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            rows.add(ForecastRow.empty(date));
        }
        log.debug("Built forecast template {}..{} ({} rows)", from, to, rows.size());
        return rows;
    }
}
