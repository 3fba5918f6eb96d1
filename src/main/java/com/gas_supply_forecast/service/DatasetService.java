package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.exception.DatasetFormatException;
import com.gas_supply_forecast.exception.FileProcessingException;
import com.gas_supply_forecast.util.DatasetColumns;
import com.gas_supply_forecast.util.DateUtil;
import com.gas_supply_forecast.util.ValidationUtil;
import com.gas_supply_forecast.util.XlsToCsv;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.RandomAccessFile;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the daily weather/supply dataset and keeps the last loaded copy in memory.
 * CSV and Excel sources are accepted; appends are only supported on CSV files.
 */
@Service
@Slf4j
public class DatasetService {

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setAllowMissingColumnNames(true)
            .build();

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    private final DateUtil dateUtil;
    private final Path datasetPath;
    private final String sheetName;
    private final AtomicReference<List<DailyRecord>> snapshot = new AtomicReference<>();

    public DatasetService(DateUtil dateUtil,
                          @Value("${forecast.dataset.path}") String datasetPath,
                          @Value("${forecast.dataset.sheet:}") String sheetName) {
        this.dateUtil = dateUtil;
        this.datasetPath = Path.of(datasetPath);
        this.sheetName = sheetName;
    }

    /**
     * Records of the configured dataset, in file order. Loaded on first use.
     */
    public List<DailyRecord> getRecords() {
        List<DailyRecord> records = snapshot.get();
        if (records == null) {
            records = reload();
        }
        return records;
    }

    public List<DailyRecord> reload() {
        List<DailyRecord> records = Collections.unmodifiableList(load(datasetPath));
        snapshot.set(records);
        return records;
    }

    public SortedSet<Integer> availableYears() {
        SortedSet<Integer> years = new TreeSet<>();
        for (DailyRecord record : getRecords()) {
            years.add(record.date().getYear());
        }
        return years;
    }

    public boolean containsDate(LocalDate date) {
        if (snapshot.get() == null && !Files.exists(datasetPath)) {
            return false;
        }
        return getRecords().stream().anyMatch(r -> r.date().equals(date));
    }

    public List<DailyRecord> load(Path path) {
        if (!Files.exists(path)) {
            throw new FileProcessingException("Dataset file not found: " + path);
        }
        log.info("📂 Loading dataset from {}", path);

        try (InputStream in = Files.newInputStream(path)) {
            List<DailyRecord> records;
            if (isSpreadsheet(path)) {
                String csv = XlsToCsv.convertExcelToCsv(in, path.getFileName().toString(), sheetName);
                records = parseCsv(new StringReader(csv), path.toString());
            } else {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    records = parseCsv(reader, path.toString());
                }
            }
            log.info("✅ Loaded {} daily records from {}", records.size(), path.getFileName());
            return records;
        } catch (IOException e) {
            throw new FileProcessingException("Failed to read dataset " + path, e);
        }
    }

    /**
     * Parses CSV text with a header row into daily records. Header names are mapped to the
     * internal columns; unknown headers are ignored. The first row of a duplicated date wins.
     *
     * @throws DatasetFormatException if a required column is absent or a cell cannot be parsed
     */
    public List<DailyRecord> parseCsv(Reader reader, String source) throws IOException {
        try (CSVParser parser = READ_FORMAT.parse(reader)) {
            Map<String, Integer> columns = resolveColumns(parser.getHeaderNames(), source);

            List<DailyRecord> records = new ArrayList<>();
            Set<LocalDate> seen = new HashSet<>();
            // header is line 1
            long line = 1;
            for (CSVRecord row : parser) {
                line++;
                String rawDate = cell(row, columns.get(DatasetColumns.DATE));
                if (ValidationUtil.isMissingCell(rawDate)) {
                    throw new DatasetFormatException(source + " line " + line + ": missing value in column 'date'");
                }

                LocalDate date;
                try {
                    date = dateUtil.parseDate(rawDate);
                } catch (DateTimeParseException e) {
                    throw new DatasetFormatException(source + " line " + line + ": unparseable date '" + rawDate + "'", e);
                }

                if (!seen.add(date)) {
                    log.warn("⚠️ Duplicate date {} at {} row {}; keeping the first occurrence", date, source, line);
                    continue;
                }

                records.add(new DailyRecord(
                        date,
                        number(row, columns, DatasetColumns.AVG_TEMP, source, line),
                        number(row, columns, DatasetColumns.MIN_TEMP, source, line),
                        number(row, columns, DatasetColumns.MAX_TEMP, source, line),
                        number(row, columns, DatasetColumns.SUPPLY_M3, source, line),
                        number(row, columns, DatasetColumns.SUPPLY_MJ, source, line)));
            }
            return records;
        } catch (IllegalArgumentException | IllegalStateException e) {
            // commons-csv reports malformed headers and quoting this way
            throw new DatasetFormatException(source + ": malformed CSV (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Appends a record to the CSV dataset unless its date is already present. Creates the file
     * with a header row when it does not exist yet.
     *
     * @return true if a row was written
     */
    public synchronized boolean appendIfAbsent(DailyRecord record) {
        if (isSpreadsheet(datasetPath)) {
            throw new FileProcessingException("Appending is only supported for CSV datasets: " + datasetPath);
        }

        try {
            boolean exists = Files.exists(datasetPath) && Files.size(datasetPath) > 0;
            if (exists && load(datasetPath).stream().anyMatch(r -> r.date().equals(record.date()))) {
                log.info("ℹ️ Date {} already present in {}; nothing appended", record.date(), datasetPath.getFileName());
                return false;
            }

            if (!exists && datasetPath.getParent() != null) {
                Files.createDirectories(datasetPath.getParent());
            }
            boolean needsNewline = exists && !endsWithNewline(datasetPath);

            try (Writer writer = Files.newBufferedWriter(datasetPath, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
                if (!exists) {
                    printer.printRecord(DatasetColumns.ALL);
                } else if (needsNewline) {
                    printer.println();
                }
                printer.printRecord(
                        record.date().format(DateTimeFormatter.ISO_LOCAL_DATE),
                        format(record.avgTemp()),
                        format(record.minTemp()),
                        format(record.maxTemp()),
                        format(record.supplyM3()),
                        format(record.supplyMj()));
            }
        } catch (IOException e) {
            throw new FileProcessingException("Failed to append to dataset " + datasetPath, e);
        }

        log.info("📝 Appended record for {} to {}", record.date(), datasetPath.getFileName());
        reload();
        return true;
    }

    private Map<String, Integer> resolveColumns(List<String> headers, String source) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            int index = i;
            DatasetColumns.normalize(header).ifPresentOrElse(
                    column -> columns.putIfAbsent(column, index),
                    () -> log.debug("Ignoring column '{}' in {}", header, source));
        }

        List<String> missing = DatasetColumns.ALL.stream().filter(c -> !columns.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new DatasetFormatException(source + ": missing required column(s) " + missing + " in header " + headers);
        }
        return columns;
    }

    private Double number(CSVRecord row, Map<String, Integer> columns, String column, String source, long line) {
        String raw = cell(row, columns.get(column));
        if (ValidationUtil.isMissingCell(raw)) {
            return null;
        }
        try {
            return Double.parseDouble(raw.replace(",", "").trim());
        } catch (NumberFormatException e) {
            throw new DatasetFormatException(source + " line " + line + ": invalid number '" + raw + "' in column '" + column + "'", e);
        }
    }

    private String cell(CSVRecord row, int index) {
        return index < row.size() ? row.get(index) : null;
    }

    private String format(Double value) {
        return value == null ? "" : value.toString();
    }

    private boolean isSpreadsheet(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xls") || name.endsWith(".xlsx");
    }

    private boolean endsWithNewline(Path path) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            if (file.length() == 0) {
                return true;
            }
            file.seek(file.length() - 1);
            return file.read() == '\n';
        }
    }
}
