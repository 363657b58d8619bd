package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.algorithms.InterpolationMethod;
import de.anton.pv.analyser.iv_analyzer.model.IvMeasurement;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ResultExporter}.
 */
class ResultExporterTest {

    private static final double[] VOLTAGE = {0.0, 0.2, 0.4, 0.6, 0.8};
    private static final double[] CURRENT = {-20.0, -19.0, -15.0, -5.0, 10.0};

    @TempDir
    Path tempDir;

    private IvAnalysisService service;
    private AnalysisConfiguration config;

    @BeforeEach
    void setUp() {
        service = new IvAnalysisService();
        config = AnalysisConfiguration.defaults()
                .withNumPoints(41)
                .withInterpolationMethod(InterpolationMethod.LINEAR)
                .withVoltageLimits(0.1, 0.65);
    }

    private static Row findRow(Sheet sheet, String name) {
        for (Row row : sheet) {
            if (row.getCell(0) != null && name.equals(row.getCell(0).getStringCellValue())) {
                return row;
            }
        }
        fail("Row '" + name + "' not found in sheet " + sheet.getSheetName());
        return null;
    }

    @Test
    @DisplayName("Writes parameters and the resampled curves")
    void export_withDensity_writesBothSheets() throws Exception {
        // ARRANGE
        IvAnalysisService.AnalysisResult result = service.runFullAnalysis(new IvMeasurement("cell", VOLTAGE, CURRENT, 1.0), config);
        Path target = tempDir.resolve("result.xlsx");

        // ACT
        new ResultExporter().export(result, target.toString());

        // ASSERT
        try (InputStream in = new FileInputStream(target.toFile()); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet parameters = workbook.getSheet(ResultExporter.PARAMETER_SHEET);
            assertNotNull(parameters);
            assertEquals(20.0, findRow(parameters, "Jsc").getCell(1).getNumericCellValue(), 1e-9);
            assertEquals(result.parameters.getPcePercent(), findRow(parameters, "PCE").getCell(1).getNumericCellValue(), 1e-12);
            assertEquals(result.parameters.getRsOhm(), findRow(parameters, "Rs").getCell(1).getNumericCellValue(), 1e-12);
            assertEquals("V", findRow(parameters, "Voc").getCell(2).getStringCellValue());

            Sheet curve = workbook.getSheet(ResultExporter.CURVE_SHEET);
            assertNotNull(curve);
            assertEquals(42, curve.getPhysicalNumberOfRows(), "Header plus one row per grid point.");
            assertEquals(3, curve.getRow(0).getPhysicalNumberOfCells());
            assertEquals(0.8, curve.getRow(41).getCell(0).getNumericCellValue(), 0.0);
            assertEquals(10.0, curve.getRow(41).getCell(2).getNumericCellValue(), 1e-9);
        }
    }

    @Test
    @DisplayName("Missing density parameters are written as blank cells")
    void export_withoutDensity_leavesBlanks() throws Exception {
        IvAnalysisService.AnalysisResult result = service.runFullAnalysis(new IvMeasurement("cell", VOLTAGE, CURRENT, null), config);
        Path target = tempDir.resolve("resistances.xlsx");

        new ResultExporter().export(result, target.toString());

        try (InputStream in = new FileInputStream(target.toFile()); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet parameters = workbook.getSheet(ResultExporter.PARAMETER_SHEET);
            assertEquals(CellType.BLANK, findRow(parameters, "Jsc").getCell(1).getCellType());
            assertEquals(CellType.BLANK, findRow(parameters, "FF").getCell(1).getCellType());
            assertEquals(CellType.NUMERIC, findRow(parameters, "Rsh").getCell(1).getCellType());
            assertEquals(2, workbook.getSheet(ResultExporter.CURVE_SHEET).getRow(0).getPhysicalNumberOfCells());
        }
    }

    @Test
    @DisplayName("An empty output path is rejected")
    void export_emptyPath_throws() {
        IvAnalysisService.AnalysisResult result = service.runFullAnalysis(new IvMeasurement("cell", VOLTAGE, CURRENT, 1.0), config);

        assertThrows(IllegalArgumentException.class, () -> new ResultExporter().export(result, " "));
    }
}
