package de.anton.pv.analyser.iv_analyzer.model;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads an I-V sweep from a measurement file and normalizes its units.
 * Two layouts are understood:
 * - Excel workbooks (.xlsx, .xls): first sheet, header in row 1, one sample per row.
 * - Delimited text (everything else): parsed with Commons CSV, header in line 1, quoted
 *   fields may contain the delimiter. Delimiter and decimal separator come from the {@link IvFileFormat}.
 * Rows whose voltage or current cannot be parsed are skipped with a warning.
 */
public class IvDataReader {

    private static final Logger logger = LoggerFactory.getLogger(IvDataReader.class);

    /**
     * Reads the file and returns the unit-normalized measurement.
     *
     * @param file   the measurement file.
     * @param format column names, units, area and separators.
     * @return voltage in V, current in mA and, if an area is given, current density in mA/cm².
     * @throws IOException if the file cannot be read, a column is missing or no valid row is found.
     */
    public IvMeasurement read(File file, IvFileFormat format) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        Objects.requireNonNull(format, "File format cannot be null.");
        logger.info("Starting to read I-V file: {}", file.getAbsolutePath());

        List<double[]> rawRows = isExcelFile(file) ? readExcelRows(file, format) : readDelimitedRows(file, format);
        if (rawRows.isEmpty()) {
            throw new IOException("No valid voltage/current rows found in '" + file.getName() + "'.");
        }

        double[] voltage = new double[rawRows.size()];
        double[] current = new double[rawRows.size()];
        for (int i = 0; i < rawRows.size(); i++) {
            double[] row = rawRows.get(i);
            voltage[i] = format.voltageUnit().toVolt(row[0]);
            current[i] = format.currentUnit().toMilliampere(row[1], format.areaCm2());
        }
        IvMeasurement measurement = new IvMeasurement(file.getName(), voltage, current, format.areaCm2());
        logger.info("Read {} samples from '{}' (voltage unit: {}, current unit: {}, area: {} cm²).",
                measurement.size(), file.getName(), format.voltageUnit(), format.currentUnit(), format.areaCm2());
        return measurement;
    }

    private boolean isExcelFile(File file) {
        String name = file.getName().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xls");
    }

    // --- Delimited Text ---

    private List<double[]> readDelimitedRows(File file, IvFileFormat format) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(format.delimiter())
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(skipBom(reader), csvFormat)) {

            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new IOException("File '" + file.getName() + "' is empty or has no header line.");
            }
            CSVRecord headers = records.next();
            int voltageCol = -1, currentCol = -1;
            for (int j = 0; j < headers.size(); j++) {
                String headerText = headers.get(j);
                if (voltageCol == -1 && headerText.equals(format.voltageColumn())) voltageCol = j;
                else if (currentCol == -1 && headerText.equals(format.currentColumn())) currentCol = j;
            }
            requireColumns(file, format, voltageCol, currentCol);
            logger.debug("Found columns in '{}': Voltage={}, Current={}", file.getName(), voltageCol, currentCol);

            List<double[]> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                double v = cellAt(record, voltageCol, format.decimalSeparator());
                double c = cellAt(record, currentCol, format.decimalSeparator());
                if (Double.isNaN(v) || Double.isNaN(c) || Double.isInfinite(v) || Double.isInfinite(c)) {
                    logger.warn("Skipping invalid row {} in '{}': '{}'", parser.getCurrentLineNumber(), file.getName(),
                            String.join(String.valueOf(format.delimiter()), record));
                    continue;
                }
                rows.add(new double[]{v, c});
            }
            return rows;
        } catch (IOException ioe) {
            logger.error("IO error reading text file: {}", file.getAbsolutePath(), ioe);
            throw ioe;
        } catch (RuntimeException e) {
            // commons-csv reports malformed input (e.g. an unterminated quote) while iterating
            logger.error("Error parsing text file: {}", file.getAbsolutePath(), e);
            throw new IOException("Error parsing text file '" + file.getName() + "': " + e.getMessage(), e);
        }
    }

    private double cellAt(CSVRecord record, int index, char decimalSeparator) {
        if (index >= record.size()) {
            return Double.NaN;
        }
        return parseNumber(record.get(index), decimalSeparator);
    }

    // --- Excel ---

    private List<double[]> readExcelRows(File file, IvFileFormat format) throws IOException {
        try (InputStream fis = new FileInputStream(file);
             Workbook workbook = WorkbookFactory.create(fis)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook '" + file.getName() + "' contains no sheets.");
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row headerRow = sheet.getRow(0);
            if (headerRow == null) {
                throw new IOException("Sheet '" + sheet.getSheetName() + "' is missing the header row (Row 1).");
            }
            int voltageCol = -1, currentCol = -1;
            for (Cell cell : headerRow) {
                if (cell == null) continue;
                String headerText = getCellValueAsString(cell, formatter, evaluator);
                if (voltageCol == -1 && headerText.equals(format.voltageColumn())) voltageCol = cell.getColumnIndex();
                else if (currentCol == -1 && headerText.equals(format.currentColumn())) currentCol = cell.getColumnIndex();
            }
            requireColumns(file, format, voltageCol, currentCol);
            logger.debug("Found columns in sheet '{}': Voltage={}, Current={}", sheet.getSheetName(), voltageCol, currentCol);

            List<double[]> rows = new ArrayList<>();
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    logger.trace("Skipping null row in '{}' at index {}", sheet.getSheetName(), i);
                    continue;
                }
                double v = getCellValueAsDouble(row.getCell(voltageCol), evaluator, format.decimalSeparator());
                double c = getCellValueAsDouble(row.getCell(currentCol), evaluator, format.decimalSeparator());
                if (Double.isNaN(v) || Double.isNaN(c) || Double.isInfinite(v) || Double.isInfinite(c)) {
                    logger.warn("Skipping invalid row {} in sheet '{}'.", i + 1, sheet.getSheetName());
                    continue;
                }
                rows.add(new double[]{v, c});
            }
            return rows;
        } catch (IOException ioe) {
            logger.error("IO error reading Excel file: {}", file.getAbsolutePath(), ioe);
            throw ioe;
        } catch (Exception e) {
            logger.error("Error processing Excel file: {}", file.getAbsolutePath(), e);
            throw new IOException("Error processing Excel file: " + e.getMessage(), e);
        }
    }

    /** Gets cell value as String, evaluating formulas. Returns empty string for null/blank. */
    private String getCellValueAsString(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return "";
        }
        return formatter.formatCellValue(cell, evaluator).trim();
    }

    /** Gets cell value as double, evaluating formulas and parsing text cells. Returns NaN for blanks and errors. */
    private double getCellValueAsDouble(Cell cell, FormulaEvaluator evaluator, char decimalSeparator) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return Double.NaN;
        }
        CellType cellType = cell.getCellType();
        if (cellType == CellType.FORMULA) {
            CellValue evaluated = evaluator.evaluate(cell);
            if (evaluated == null) return Double.NaN;
            switch (evaluated.getCellType()) {
                case NUMERIC: return evaluated.getNumberValue();
                case STRING: return parseNumber(evaluated.getStringValue(), decimalSeparator);
                default:
                    logger.warn("Formula in cell {} did not produce a number.", cell.getAddress());
                    return Double.NaN;
            }
        }
        switch (cellType) {
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING:
                return parseNumber(cell.getStringCellValue(), decimalSeparator);
            default:
                logger.warn("Unhandled cell type {} in cell {}. Returning NaN.", cellType, cell.getAddress());
                return Double.NaN;
        }
    }

    // --- Helpers ---

    private void requireColumns(File file, IvFileFormat format, int voltageCol, int currentCol) throws IOException {
        if (voltageCol == -1 || currentCol == -1) {
            throw new IOException(String.format("Could not find required column(s) in '%s'. Missing: %s%s",
                    file.getName(),
                    voltageCol == -1 ? "'" + format.voltageColumn() + "' " : "",
                    currentCol == -1 ? "'" + format.currentColumn() + "'" : ""));
        }
    }

    /**
     * Parses a number written with the given decimal separator.
     * Returns NaN for empty input or anything that is not a plain number.
     */
    static double parseNumber(String valueStr, char decimalSeparator) {
        if (valueStr == null) {
            return Double.NaN;
        }
        String cleaned = valueStr.trim();
        if (cleaned.isEmpty() || cleaned.equals("-")) {
            return Double.NaN;
        }
        if (decimalSeparator != '.') {
            cleaned = cleaned.replace(decimalSeparator, '.');
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            logger.trace("Could not parse number from '{}': {}", valueStr, e.getMessage());
            return Double.NaN;
        }
    }

    /** Drops a leading UTF-8 byte order mark so it does not end up in the first header. */
    private static Reader skipBom(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
        return reader;
    }
}
