package com.gas_supply_forecast.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gas_supply_forecast.exception.FileProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * South Korean public holidays per calendar year.
 * <p>
 * Solar holidays follow fixed dates. Lunar holidays (설날, 부처님오신날, 추석) and one-off days
 * (elections, temporary holidays) come from the bundled table {@code holidays/kr-lunar-holidays.json};
 * years outside the table only get solar holidays. Substitute holidays are assigned to the first
 * weekday after the triggering holiday that is not already a holiday.
 */
@Component
@Slf4j
public class KoreanHolidayCalendar {

    static final String TABLE_RESOURCE = "holidays/kr-lunar-holidays.json";
    private static final String NAME_SEPARATOR = "; ";

    private enum SubstituteRule {
        NONE(Integer.MAX_VALUE, false, false, false),
        // 설날, 추석
        LUNAR_PERIOD(2014, false, true, true),
        // 어린이날
        CHILDRENS_DAY(2014, true, true, true),
        // 삼일절, 광복절, 개천절, 한글날
        NATIONAL_DAY(2021, true, true, false),
        // 부처님오신날, 기독탄신일
        RELIGIOUS_DAY(2023, true, true, false);

        private final int sinceYear;
        private final boolean saturday;
        private final boolean sunday;
        private final boolean overlap;

        SubstituteRule(int sinceYear, boolean saturday, boolean sunday, boolean overlap) {
            this.sinceYear = sinceYear;
            this.saturday = saturday;
            this.sunday = sunday;
            this.overlap = overlap;
        }
    }

    private record Holiday(LocalDate date, String name, String substituteName, SubstituteRule rule, LocalDate searchFrom) {
    }

    private static final List<SolarHoliday> SOLAR_HOLIDAYS = List.of(
            new SolarHoliday(MonthDay.of(1, 1), "신정", SubstituteRule.NONE),
            new SolarHoliday(MonthDay.of(3, 1), "삼일절", SubstituteRule.NATIONAL_DAY),
            new SolarHoliday(MonthDay.of(5, 5), "어린이날", SubstituteRule.CHILDRENS_DAY),
            new SolarHoliday(MonthDay.of(6, 6), "현충일", SubstituteRule.NONE),
            new SolarHoliday(MonthDay.of(8, 15), "광복절", SubstituteRule.NATIONAL_DAY),
            new SolarHoliday(MonthDay.of(10, 3), "개천절", SubstituteRule.NATIONAL_DAY),
            new SolarHoliday(MonthDay.of(10, 9), "한글날", SubstituteRule.NATIONAL_DAY),
            new SolarHoliday(MonthDay.of(12, 25), "기독탄신일", SubstituteRule.RELIGIOUS_DAY)
    );

    private record SolarHoliday(MonthDay monthDay, String name, SubstituteRule rule) {
    }

    private final JsonNode lunarTable;
    private final Map<Integer, SortedMap<LocalDate, String>> cache = new ConcurrentHashMap<>();

    public KoreanHolidayCalendar(ObjectMapper objectMapper) {
        this.lunarTable = loadTable(objectMapper);
    }

    private static JsonNode loadTable(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(TABLE_RESOURCE).getInputStream()) {
            JsonNode table = objectMapper.readTree(in);
            log.info("📅 Loaded lunar holiday table for {} years", table.size());
            return table;
        } catch (IOException e) {
            throw new FileProcessingException("Could not read holiday table " + TABLE_RESOURCE, e);
        }
    }

    /**
     * Holidays of one year, sorted by date. Every key lies inside {@code year}; coinciding
     * holidays share one entry with their names joined by {@code "; "}.
     */
    public SortedMap<LocalDate, String> holidaysOf(int year) {
        return cache.computeIfAbsent(year, this::buildYear);
    }

    /**
     * Holiday name for a date, or an empty string for an ordinary day.
     */
    public String holidayName(LocalDate date) {
        return holidaysOf(date.getYear()).getOrDefault(date, "");
    }

    private SortedMap<LocalDate, String> buildYear(int year) {
        List<Holiday> holidays = new ArrayList<>();
        for (SolarHoliday solar : SOLAR_HOLIDAYS) {
            LocalDate date = solar.monthDay().atYear(year);
            holidays.add(new Holiday(date, solar.name(), solar.name(), solar.rule(), date.plusDays(1)));
        }

        JsonNode entry = lunarTable.get(String.valueOf(year));
        if (entry == null) {
            log.warn("⚠️ Year {} is outside the lunar holiday table; only solar holidays are used", year);
        } else {
            addLunarPeriod(holidays, LocalDate.parse(entry.get("seollal").asText()), "설날");
            addLunarPeriod(holidays, LocalDate.parse(entry.get("chuseok").asText()), "추석");

            LocalDate buddha = LocalDate.parse(entry.get("buddhasBirthday").asText());
            holidays.add(new Holiday(buddha, "부처님오신날", "부처님오신날", SubstituteRule.RELIGIOUS_DAY, buddha.plusDays(1)));

            JsonNode special = entry.get("special");
            if (special != null) {
                Iterator<Map.Entry<String, JsonNode>> fields = special.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    LocalDate date = LocalDate.parse(field.getKey());
                    holidays.add(new Holiday(date, field.getValue().asText(), null, SubstituteRule.NONE, date));
                }
            }
        }

        TreeMap<LocalDate, List<String>> names = new TreeMap<>();
        for (Holiday holiday : holidays) {
            names.computeIfAbsent(holiday.date(), d -> new ArrayList<>()).add(holiday.name());
        }

        holidays.sort(Comparator.comparing(Holiday::date));
        for (Holiday holiday : holidays) {
            if (needsSubstitute(holiday, names)) {
                LocalDate substitute = nextFreeWeekday(holiday.searchFrom(), names);
                names.computeIfAbsent(substitute, d -> new ArrayList<>())
                        .add("대체공휴일(" + holiday.substituteName() + ")");
            }
        }

        TreeMap<LocalDate, String> result = new TreeMap<>();
        names.forEach((date, dayNames) -> {
            if (date.getYear() == year) {
                result.put(date, String.join(NAME_SEPARATOR, dayNames));
            }
        });
        log.debug("Built {} holidays for {}", result.size(), year);
        return Collections.unmodifiableSortedMap(result);
    }

    private void addLunarPeriod(List<Holiday> holidays, LocalDate day, String name) {
        LocalDate searchFrom = day.plusDays(2);
        holidays.add(new Holiday(day.minusDays(1), name + " 전날", name, SubstituteRule.LUNAR_PERIOD, searchFrom));
        holidays.add(new Holiday(day, name, name, SubstituteRule.LUNAR_PERIOD, searchFrom));
        holidays.add(new Holiday(day.plusDays(1), name + " 다음날", name, SubstituteRule.LUNAR_PERIOD, searchFrom));
    }

    private boolean needsSubstitute(Holiday holiday, Map<LocalDate, List<String>> names) {
        SubstituteRule rule = holiday.rule();
        if (holiday.date().getYear() < rule.sinceYear) {
            return false;
        }
        DayOfWeek dayOfWeek = holiday.date().getDayOfWeek();
        return (rule.saturday && dayOfWeek == DayOfWeek.SATURDAY)
                || (rule.sunday && dayOfWeek == DayOfWeek.SUNDAY)
                || (rule.overlap && names.get(holiday.date()).size() > 1);
    }

    private LocalDate nextFreeWeekday(LocalDate from, Map<LocalDate, List<String>> names) {
        LocalDate candidate = from;
        while (candidate.getDayOfWeek() == DayOfWeek.SATURDAY
                || candidate.getDayOfWeek() == DayOfWeek.SUNDAY
                || names.containsKey(candidate)) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }
}
