package com.gas_supply_forecast.util;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

@Component
public class DateUtil {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd")
    );

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Parse a calendar day written as yyyy-MM-dd, yyyyMMdd, yyyy/MM/dd, yyyy.MM.dd
     * or a spreadsheet timestamp (yyyy-MM-dd HH:mm:ss, time discarded).
     *
     * @param value the raw cell value
     * @return parsed LocalDate
     * @throws DateTimeParseException if none of the formats match
     */
    public LocalDate parseDate(String value) {
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = tryParse(trimmed, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return LocalDateTime.parse(trimmed, DATE_TIME_FORMAT).toLocalDate();
    }

    private LocalDate tryParse(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public LocalDate lastDayOfMonth(LocalDate date) {
        return date.withDayOfMonth(date.lengthOfMonth());
    }
}
