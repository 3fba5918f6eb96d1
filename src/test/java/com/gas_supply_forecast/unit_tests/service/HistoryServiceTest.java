package com.gas_supply_forecast.unit_tests.service;

import com.gas_supply_forecast.dto.history.MonthlySummaryDTO;
import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import com.gas_supply_forecast.service.DatasetService;
import com.gas_supply_forecast.service.HistoryService;
import com.gas_supply_forecast.unit_tests.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryServiceTest {

    @Mock
    private DatasetService datasetService;

    private HistoryService historyService;

    @BeforeEach
    void setUp() {
        historyService = new HistoryService(datasetService, TestRecords.enrichment());
        when(datasetService.getRecords()).thenReturn(List.of(
                new DailyRecord(LocalDate.of(2024, 1, 30), -2.0, -6.0, 2.0, 1_200_000.0, 51_720_000.0),
                new DailyRecord(LocalDate.of(2024, 1, 31), 1.0, -3.0, 5.0, 1_100_000.0, null),
                new DailyRecord(LocalDate.of(2024, 2, 1), null, -1.0, 7.0, null, null),
                new DailyRecord(LocalDate.of(2023, 12, 31), -4.0, -9.0, 0.0, 1_300_000.0, 56_030_000.0)));
    }

    @Test
    void aggregatesPerMonthInCalendarOrder() {
        List<MonthlySummaryDTO> summary = historyService.monthlySummary(null, null);

        assertThat(summary).extracting(MonthlySummaryDTO::getYear, MonthlySummaryDTO::getMonth)
                .containsExactly(
                        tuple(2023, 12),
                        tuple(2024, 1),
                        tuple(2024, 2));

        MonthlySummaryDTO january = summary.get(1);
        assertThat(january.getDays()).isEqualTo(2);
        assertThat(january.getAvgTemp()).isCloseTo(-0.5, within(1e-9));
        assertThat(january.getSupplyM3()).isEqualTo(2_300_000.0);
        assertThat(january.getSupplyMj()).isEqualTo(51_720_000.0);
    }

    @Test
    void monthWithoutValuesReportsNull() {
        MonthlySummaryDTO february = historyService.monthlySummary(Set.of(2024), Set.of(2)).get(0);

        assertThat(february.getDays()).isEqualTo(1);
        assertThat(february.getAvgTemp()).isNull();
        assertThat(february.getSupplyM3()).isNull();
    }

    @Test
    void dailyRecordsAreFilteredAndEnriched() {
        List<EnrichedRecord> records = historyService.dailyRecords(Set.of(2024), null, Set.of(WeekdayEnum.WEDNESDAY));

        assertThat(records).extracting(EnrichedRecord::date).containsExactly(LocalDate.of(2024, 1, 31));
        assertThat(records.get(0).weekday().getLabel()).isEqualTo("수");
    }
}
