package com.gas_supply_forecast.util;

import com.gas_supply_forecast.exception.FileProcessingException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public class XlsToCsv {
    private static final Logger logger = LoggerFactory.getLogger(XlsToCsv.class);

    private XlsToCsv() {
    }

    /**
     * Converts one sheet of an Excel workbook (.xls or .xlsx) to CSV text. Date cells are written
     * as ISO dates so the dataset reader sees the same format it gets from CSV sources.
     *
     * @param excelInputStream workbook content
     * @param sourceName       file name, for logging
     * @param sheetName        sheet to read, or null/blank for the first sheet
     * @return CSV text, header row first
     * @throws FileProcessingException if the workbook cannot be read or the sheet is missing/empty
     */
    public static String convertExcelToCsv(InputStream excelInputStream, String sourceName, String sheetName) {
        logger.info("📊 Converting Excel file to CSV: {}", sourceName);

        try (Workbook workbook = WorkbookFactory.create(new BufferedInputStream(excelInputStream))) {
            Sheet sheet = ValidationUtil.stringExists(sheetName) ? workbook.getSheet(sheetName) : workbook.getSheetAt(0);
            if (sheet == null) {
                throw new FileProcessingException("Sheet '" + sheetName + "' not found in " + sourceName);
            }
            logger.info("📄 Processing sheet: {} with {} rows", sheet.getSheetName(), sheet.getPhysicalNumberOfRows());

            int maxColumns = 0;
            for (Row row : sheet) {
                maxColumns = Math.max(maxColumns, row.getLastCellNum());
            }
            if (maxColumns <= 0) {
                throw new FileProcessingException("Excel sheet is empty or has no columns: " + sourceName);
            }

            StringWriter out = new StringWriter();
            int rowCount = 0;
            try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
                for (Row row : sheet) {
                    List<String> values = new ArrayList<>(maxColumns);
                    for (int colIndex = 0; colIndex < maxColumns; colIndex++) {
                        values.add(getCellValueAsString(row.getCell(colIndex, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)));
                    }
                    if (values.stream().allMatch(String::isEmpty)) {
                        continue;
                    }
                    printer.printRecord(values);
                    rowCount++;
                }
            }

            logger.info("✅ Excel to CSV conversion complete: {} rows x {} columns", rowCount, maxColumns);
            return out.toString();
        } catch (IOException e) {
            logger.error("❌ Failed to convert Excel to CSV: {}", e.getMessage());
            throw new FileProcessingException("Failed to convert Excel file to CSV format: " + sourceName, e);
        }
    }

    private static String getCellValueAsString(Cell cell) {
        if (cell == null) {
            return "";
        }

        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
                }
                return formatNumber(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                return getCachedFormulaValue(cell.getCachedFormulaResultType(), cell);
            default:
                return "";
        }
    }

    private static String getCachedFormulaValue(CellType cellType, Cell cell) {
        switch (cellType) {
            case STRING:
                return cell.getRichStringCellValue().getString().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
                }
                return formatNumber(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    // avoids scientific notation for large supply figures
    private static String formatNumber(double value) {
        if (value == (long) value) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }
}
