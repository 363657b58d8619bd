package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.model.MaximumPowerPoint;
import de.anton.pv.analyser.iv_analyzer.model.PhotovoltaicParameters;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports an analysis result to an Excel file (.xlsx) with a parameter sheet and a curve sheet.
 */
public class ResultExporter {

    private static final Logger logger = LoggerFactory.getLogger(ResultExporter.class);

    public static final String PARAMETER_SHEET = "Parameter";
    public static final String CURVE_SHEET = "Kurve";

    private static final int COLUMN_WIDTH = 26 * 256; // fixed, autoSizeColumn needs font metrics
    private static final List<String> PARAMETER_COLUMNS = List.of("Parameter", "Wert", "Einheit");

    public void export(IvAnalysisService.AnalysisResult result, String filePath) throws IOException {
        Objects.requireNonNull(result, "Result cannot be null.");
        if (filePath == null || filePath.trim().isEmpty()) { throw new IllegalArgumentException("Output file path cannot be null or empty."); }

        logger.info("Starting Excel export process to: {}", filePath);
        try (Workbook workbook = new XSSFWorkbook(); FileOutputStream fileOut = new FileOutputStream(filePath)) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            writeParameterSheet(workbook.createSheet(PARAMETER_SHEET), headerStyle, result.parameters);
            writeCurveSheet(workbook.createSheet(CURVE_SHEET), headerStyle, result.currentCurve, result.densityCurve);
            logger.debug("Writing workbook to file...");
            workbook.write(fileOut);
            logger.info("Excel export completed successfully to: {}", filePath);
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", filePath, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during Excel export to {}", filePath, e);
            throw new IOException("Unerwarteter Fehler beim Excel-Export: " + e.getMessage(), e);
        }
    }

    private void writeParameterSheet(Sheet sheet, CellStyle headerStyle, PhotovoltaicParameters parameters) {
        writeHeader(sheet, headerStyle, PARAMETER_COLUMNS);
        MaximumPowerPoint mpp = parameters.getMaximumPowerPoint();
        int rowNum = 1;
        rowNum = writeParameter(sheet, rowNum, "Jsc", Math.abs(parameters.getJscMACm2()), "mA/cm²");
        rowNum = writeParameter(sheet, rowNum, "Voc", parameters.getVocV(), "V");
        rowNum = writeParameter(sheet, rowNum, "FF", parameters.getFillFactor() * 100, "%");
        rowNum = writeParameter(sheet, rowNum, "PCE", parameters.getPcePercent(), "%");
        rowNum = writeParameter(sheet, rowNum, "Rs", parameters.getRsOhm(), "Ω");
        rowNum = writeParameter(sheet, rowNum, "Rsh", parameters.getRshOhm(), "Ω");
        rowNum = writeParameter(sheet, rowNum, "Vmp", mpp != null ? mpp.voltage() : Double.NaN, "V");
        rowNum = writeParameter(sheet, rowNum, "Jmp", mpp != null ? mpp.currentDensity() : Double.NaN, "mA/cm²");
        writeParameter(sheet, rowNum, "Pmp", mpp != null ? mpp.powerDensity() : Double.NaN, "mW/cm²");
    }

    private int writeParameter(Sheet sheet, int rowNum, String name, double value, String unit) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(name);
        createNumericCell(row, 1, value);
        row.createCell(2).setCellValue(unit);
        return rowNum + 1;
    }

    private void writeCurveSheet(Sheet sheet, CellStyle headerStyle, ResampledCurve currentCurve, ResampledCurve densityCurve) {
        List<String> columns = new ArrayList<>(List.of(currentCurve.getXLabel(), currentCurve.getYLabel()));
        if (densityCurve != null) { columns.add(densityCurve.getYLabel()); }
        writeHeader(sheet, headerStyle, columns);

        for (int i = 0; i < currentCurve.size(); i++) {
            Row row = sheet.createRow(i + 1);
            createNumericCell(row, 0, currentCurve.getX(i));
            createNumericCell(row, 1, currentCurve.getY(i));
            if (densityCurve != null && i < densityCurve.size()) { createNumericCell(row, 2, densityCurve.getY(i)); }
        }
        logger.debug("Wrote {} curve rows ({} columns).", currentCurve.size(), columns.size());
    }

    private void writeHeader(Sheet sheet, CellStyle headerStyle, List<String> columns) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) { Cell cell = headerRow.createCell(i); cell.setCellValue(columns.get(i)); cell.setCellStyle(headerStyle); sheet.setColumnWidth(i, COLUMN_WIDTH); }
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFont(headerFont);
        return headerStyle;
    }

    private void createNumericCell(Row row, int colIndex, double value) { if (!Double.isNaN(value) && !Double.isInfinite(value)) { row.createCell(colIndex).setCellValue(value); } else { row.createCell(colIndex, CellType.BLANK); } }
}
