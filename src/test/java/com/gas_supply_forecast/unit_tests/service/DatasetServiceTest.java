package com.gas_supply_forecast.unit_tests.service;

import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.exception.DatasetFormatException;
import com.gas_supply_forecast.exception.FileProcessingException;
import com.gas_supply_forecast.service.DatasetService;
import com.gas_supply_forecast.util.DateUtil;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetServiceTest {

    @TempDir
    Path tempDir;

    private DatasetService serviceFor(Path path) {
        return new DatasetService(new DateUtil(), path.toString(), "");
    }

    private Path copyFixture() throws IOException {
        Path target = tempDir.resolve("daily.csv");
        try (InputStream in = getClass().getResourceAsStream("/datasets/daily_sample.csv")) {
            Files.copy(in, target);
        }
        return target;
    }

    @Nested
    @DisplayName("CSV loading")
    class CsvLoading {

        @Test
        void normalizesKoreanHeadersAndParsesValues() throws IOException {
            List<DailyRecord> records = serviceFor(copyFixture()).getRecords();

            assertThat(records).hasSize(5);
            DailyRecord first = records.get(0);
            assertThat(first.date()).isEqualTo(LocalDate.of(2024, 1, 1));
            assertThat(first.avgTemp()).isEqualTo(-1.5);
            assertThat(first.minTemp()).isEqualTo(-5.2);
            assertThat(first.maxTemp()).isEqualTo(3.1);
            assertThat(first.supplyM3()).isEqualTo(1_234_567.0);
        }

        @Test
        void firstOccurrenceOfDuplicateDateWins() throws IOException {
            List<DailyRecord> records = serviceFor(copyFixture()).getRecords();

            DailyRecord second = records.get(1);
            assertThat(second.date()).isEqualTo(LocalDate.of(2024, 1, 2));
            assertThat(second.avgTemp()).isEqualTo(0.3);
        }

        @Test
        void missingCellsBecomeNullAndAlternateDateFormatsParse() throws IOException {
            List<DailyRecord> records = serviceFor(copyFixture()).getRecords();

            assertThat(records.get(2).date()).isEqualTo(LocalDate.of(2024, 1, 3));
            assertThat(records.get(2).avgTemp()).isNull();
            assertThat(records.get(2).supplyMj()).isNull();
            assertThat(records.get(3).date()).isEqualTo(LocalDate.of(2024, 1, 4));
            assertThat(records.get(3).minTemp()).isNull();
        }

        @Test
        void availableYearsAreDerivedFromDates() throws IOException {
            assertThat(serviceFor(copyFixture()).availableYears()).containsExactly(2024);
        }

        @Test
        void unparseableDateIsAContractViolation() {
            String csv = "date,avg_temp,min_temp,max_temp,supply_m3,supply_mj\n2024-13-45,1,0,2,10,20\n";
            DatasetService service = serviceFor(tempDir.resolve("unused.csv"));

            assertThatThrownBy(() -> service.parseCsv(new StringReader(csv), "inline"))
                    .isInstanceOf(DatasetFormatException.class)
                    .hasMessageContaining("line 2")
                    .hasMessageContaining("2024-13-45");
        }

        @Test
        void unparseableNumberNamesTheColumn() {
            String csv = "date,avg_temp,min_temp,max_temp,supply_m3,supply_mj\n2024-01-01,warm,0,2,10,20\n";
            DatasetService service = serviceFor(tempDir.resolve("unused.csv"));

            assertThatThrownBy(() -> service.parseCsv(new StringReader(csv), "inline"))
                    .isInstanceOf(DatasetFormatException.class)
                    .hasMessageContaining("avg_temp");
        }

        @Test
        void missingRequiredColumnIsAContractViolation() {
            String csv = "avg_temp,min_temp,max_temp,supply_m3,supply_mj\n1,0,2,10,20\n";
            DatasetService service = serviceFor(tempDir.resolve("unused.csv"));

            assertThatThrownBy(() -> service.parseCsv(new StringReader(csv), "inline"))
                    .isInstanceOf(DatasetFormatException.class)
                    .hasMessageContaining("date");
        }

        @Test
        void missingFileIsReported() {
            assertThatThrownBy(() -> serviceFor(tempDir.resolve("absent.csv")).getRecords())
                    .isInstanceOf(FileProcessingException.class);
        }
    }

    @Test
    @DisplayName("Excel datasets are converted before parsing")
    void loadsSpreadsheet() throws IOException {
        Path xlsx = tempDir.resolve("daily.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(xlsx)) {
            Sheet sheet = workbook.createSheet("일별");
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Row header = sheet.createRow(0);
            String[] names = {"날짜", "평균기온", "최저기온", "최고기온", "공급량(M3)", "공급량(MJ)"};
            for (int i = 0; i < names.length; i++) {
                header.createCell(i).setCellValue(names[i]);
            }
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue(LocalDate.of(2023, 12, 31));
            row.getCell(0).setCellStyle(dateStyle);
            row.createCell(1).setCellValue(-3.5);
            row.createCell(2).setCellValue(-8.0);
            row.createCell(3).setCellValue(1.0);
            row.createCell(4).setCellValue(1_300_000);
            row.createCell(5).setCellValue(56_030_000);
            workbook.write(out);
        }

        List<DailyRecord> records = serviceFor(xlsx).getRecords();

        assertThat(records).containsExactly(
                new DailyRecord(LocalDate.of(2023, 12, 31), -3.5, -8.0, 1.0, 1_300_000.0, 56_030_000.0));
    }

    @Nested
    @DisplayName("appending")
    class Appending {

        @Test
        void appendIsIdempotentPerDate() throws IOException {
            Path csv = copyFixture();
            DatasetService service = serviceFor(csv);
            DailyRecord observation = DailyRecord.temperatures(LocalDate.of(2024, 2, 11), 1.2, -3.4, 6.5);

            assertThat(service.appendIfAbsent(observation)).isTrue();
            assertThat(service.appendIfAbsent(observation)).isFalse();

            List<DailyRecord> records = service.getRecords();
            assertThat(records).filteredOn(r -> r.date().equals(LocalDate.of(2024, 2, 11))).hasSize(1);
            assertThat(records.get(records.size() - 1)).isEqualTo(observation);
        }

        @Test
        void existingDateIsNotWrittenAgain() throws IOException {
            Path csv = copyFixture();
            String before = Files.readString(csv, StandardCharsets.UTF_8);

            boolean appended = serviceFor(csv).appendIfAbsent(DailyRecord.temperatures(LocalDate.of(2024, 1, 1), 0.0, 0.0, 0.0));

            assertThat(appended).isFalse();
            assertThat(Files.readString(csv, StandardCharsets.UTF_8)).isEqualTo(before);
        }

        @Test
        void createsFileWithHeaderWhenAbsent() throws IOException {
            Path csv = tempDir.resolve("new/daily.csv");
            DatasetService service = serviceFor(csv);

            service.appendIfAbsent(DailyRecord.temperatures(LocalDate.of(2024, 3, 1), 5.0, 1.0, 9.0));

            List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
            assertThat(lines).containsExactly(
                    "date,avg_temp,min_temp,max_temp,supply_m3,supply_mj",
                    "2024-03-01,5.0,1.0,9.0,,");
            assertThat(service.getRecords()).hasSize(1);
        }

        @Test
        void appendsAfterFileWithoutTrailingNewline() throws IOException {
            Path csv = tempDir.resolve("daily.csv");
            Files.writeString(csv, "date,avg_temp,min_temp,max_temp,supply_m3,supply_mj\n2024-01-01,1,0,2,10,20",
                    StandardCharsets.UTF_8);
            DatasetService service = serviceFor(csv);

            service.appendIfAbsent(DailyRecord.temperatures(LocalDate.of(2024, 1, 2), 2.0, 1.0, 3.0));

            assertThat(service.getRecords()).extracting(DailyRecord::date)
                    .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2));
        }
    }
}
