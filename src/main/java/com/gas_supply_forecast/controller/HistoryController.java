package com.gas_supply_forecast.controller;

import com.gas_supply_forecast.dto.history.MonthlySummaryDTO;
import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.dto.response.GenericResponse;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import com.gas_supply_forecast.exception.BadRequestException;
import com.gas_supply_forecast.service.HistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/history")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "History", description = "Historical weather and supply records")
public class HistoryController {

    private final HistoryService historyService;

    @Operation(summary = "Monthly mean temperature and total supply")
    @GetMapping("/monthly")
    public ResponseEntity<GenericResponse<List<MonthlySummaryDTO>>> monthly(
            @RequestParam(required = false) List<Integer> years,
            @RequestParam(required = false) List<Integer> months) {
        return ResponseEntity.ok(GenericResponse.success("Monthly summary", historyService.monthlySummary(years, months)));
    }

    @Operation(summary = "Daily records with calendar and holiday attributes")
    @GetMapping("/daily")
    public ResponseEntity<GenericResponse<List<EnrichedRecord>>> daily(
            @RequestParam(required = false) List<Integer> years,
            @RequestParam(required = false) List<Integer> months,
            @RequestParam(required = false) List<String> weekdays) {
        List<WeekdayEnum> weekdayFilter = weekdays == null ? null : weekdays.stream()
                .map(w -> WeekdayEnum.fromLabel(w).orElseThrow(() -> new BadRequestException("Unknown weekday: " + w)))
                .toList();
        return ResponseEntity.ok(GenericResponse.success("Daily records",
                historyService.dailyRecords(years, months, weekdayFilter)));
    }
}
