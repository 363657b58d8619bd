package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.algorithms.InterpolationMethod;
import de.anton.pv.analyser.iv_analyzer.model.ImplausibleParameterException;
import de.anton.pv.analyser.iv_analyzer.model.InsufficientDataException;
import de.anton.pv.analyser.iv_analyzer.model.IvMeasurement;
import de.anton.pv.analyser.iv_analyzer.model.PhotovoltaicParameters;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import de.anton.pv.analyser.iv_analyzer.model.ValidationMode;
import de.anton.pv.analyser.iv_analyzer.view.CurveRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link IvAnalysisService}.
 */
@ExtendWith(MockitoExtension.class)
class IvAnalysisServiceTest {

    private static final double[] VOLTAGE = {0.0, 0.2, 0.4, 0.6, 0.8};
    private static final double[] DENSITY = {-20.0, -19.0, -15.0, -5.0, 10.0};

    @Mock
    private CurveRenderer renderer;

    private IvAnalysisService service;
    private AnalysisConfiguration linearConfig;

    @BeforeEach
    void setUp() {
        service = new IvAnalysisService(renderer);
        linearConfig = AnalysisConfiguration.defaults()
                .withInterpolationMethod(InterpolationMethod.LINEAR)
                .withHighVoltageFactor(0.9);
    }

    /** Area 1 cm², so current in mA equals current density in mA/cm². */
    private static IvMeasurement unitAreaMeasurement(double[] density) {
        return new IvMeasurement("synthetic", VOLTAGE, density, 1.0);
    }

    @Test
    @DisplayName("End-to-end extraction of a typical illuminated curve")
    void runFullAnalysis_typicalCurve() {
        // ACT
        IvAnalysisService.AnalysisResult result = service.runFullAnalysis(unitAreaMeasurement(DENSITY), linearConfig);

        // ASSERT
        PhotovoltaicParameters p = result.parameters;
        assertTrue(p.hasDensityParameters());
        assertEquals(-20.0, p.getJscMACm2(), 1e-9, "Jsc");
        assertEquals(0.6667, p.getVocV(), 1e-3, "Voc");
        assertEquals(0.4, p.getMaximumPowerPoint().voltage(), 1e-3, "V_mp");
        assertEquals(-6.0, p.getMaximumPowerPoint().powerDensity(), 1e-2, "P_mp");
        assertEquals(0.45, p.getFillFactor(), 1e-2, "FF");
        assertEquals(6.0, p.getPcePercent(), 1e-2, "PCE");
        // shunt: 5 mA/V on [0, 0.2]; series: 75 mA/V above 0.9 * Voc = 0.6 V
        assertEquals(200.0, p.getRshOhm(), 1e-6, "Rsh");
        assertEquals(1000.0 / 75.0, p.getRsOhm(), 1e-6, "Rs");
        assertTrue(result.hasDensityCurve());
        assertEquals(AnalysisConfiguration.defaults().numPoints(), result.currentCurve.size());
        assertEquals(ResampledCurve.LABEL_CURRENT_DENSITY, result.densityCurve.getYLabel());
    }

    @Test
    @DisplayName("Default cubic pipeline on a 10 mV sweep of J = -20 + 5V + aV^4 with Voc = 0.6 V")
    void runFullAnalysis_defaultCubicConfiguration() {
        // ARRANGE: a chosen so that J(0.6) = 0; sampled from 0 to 0.7 V in 10 mV steps
        double a = 17.0 / Math.pow(0.6, 4);
        double[] voltage = new double[71];
        double[] density = new double[71];
        for (int i = 0; i < voltage.length; i++) {
            voltage[i] = i * 0.01;
            density[i] = -20.0 + 5.0 * voltage[i] + a * Math.pow(voltage[i], 4);
        }
        AnalysisConfiguration config = AnalysisConfiguration.defaults().withHighVoltageFactor(0.9);

        // ACT
        IvAnalysisService.AnalysisResult result = service.runFullAnalysis(
                new IvMeasurement("quartic", voltage, density, 1.0), config);

        // ASSERT
        PhotovoltaicParameters p = result.parameters;
        assertEquals(InterpolationMethod.CUBIC, result.currentCurve.getMethod());
        assertEquals(-20.0, p.getJscMACm2(), 1e-3, "Jsc");
        assertEquals(0.6, p.getVocV(), 1e-3, "Voc");
        // dP/dV = 0 at V = 0.3955, P = -5.8586 mW/cm²
        assertEquals(0.3955, p.getMaximumPowerPoint().voltage(), 2e-3, "V_mp");
        assertEquals(0.4882, p.getFillFactor(), 2e-3, "FF");
        assertTrue(p.getFillFactor() <= 1.0, "FF cannot exceed 1");
        assertEquals(5.859, p.getPcePercent(), 2e-2, "PCE");
        // shunt slope on [0, 0.1): 5 + 0.8 * a * 0.1^3 mA/V
        assertEquals(1000.0 / (5.0 + 0.0008 * a), p.getRshOhm(), 1.0, "Rsh");
        // series slope on (0.54, 0.7]: 5 + a * (4 m^3 + 12 m w^2 / 5), m = 0.62, w = 0.08
        double seriesSlope = 5.0 + a * (4 * Math.pow(0.62, 3) + 12 * 0.62 * 0.08 * 0.08 / 5);
        assertEquals(1000.0 / seriesSlope, p.getRsOhm(), 0.05, "Rs");
    }

    @Test
    @DisplayName("Without area only Rs and Rsh are extracted, the factor falls back to the absolute limit")
    void runFullAnalysis_withoutArea_resistancesOnly() {
        IvMeasurement measurement = new IvMeasurement("no-area", VOLTAGE, DENSITY, null);
        AnalysisConfiguration config = linearConfig.withVoltageLimits(0.1, 0.65);

        IvAnalysisService.AnalysisResult result = service.runFullAnalysis(measurement, config);

        assertFalse(result.parameters.hasDensityParameters());
        assertTrue(Double.isNaN(result.parameters.getJscMACm2()));
        assertTrue(Double.isNaN(result.parameters.getPcePercent()));
        assertNull(result.densityCurve);
        assertEquals(1000.0 / 75.0, result.parameters.getRsOhm(), 1e-6);
        assertEquals(200.0, result.parameters.getRshOhm(), 1e-6);
    }

    @Test
    @DisplayName("Strict mode rejects a negative shunt resistance, permissive mode returns it")
    void runFullAnalysis_validationModes() {
        IvMeasurement measurement = unitAreaMeasurement(new double[]{-19.0, -20.0, -15.0, -5.0, 10.0});

        PhotovoltaicParameters permissive = service.runFullAnalysis(measurement, linearConfig).parameters;
        assertTrue(permissive.getRshOhm() < 0, "Falling current near 0 V gives a negative Rsh.");

        AnalysisConfiguration strict = linearConfig.withValidationMode(ValidationMode.STRICT);
        ImplausibleParameterException ex = assertThrows(ImplausibleParameterException.class,
                () -> service.runFullAnalysis(measurement, strict));
        assertEquals("Rsh", ex.getParameterName());
    }

    @Test
    @DisplayName("The renderer sees the current and the density curve when rendering is enabled")
    void runFullAnalysis_renderingEnabled_rendersBothCurves() {
        service.runFullAnalysis(unitAreaMeasurement(DENSITY), linearConfig.withRenderCurves(true));

        ArgumentCaptor<ResampledCurve> captor = ArgumentCaptor.forClass(ResampledCurve.class);
        verify(renderer, times(2)).render(captor.capture());
        List<ResampledCurve> curves = captor.getAllValues();
        assertEquals(ResampledCurve.LABEL_CURRENT, curves.get(0).getYLabel());
        assertEquals(ResampledCurve.LABEL_CURRENT_DENSITY, curves.get(1).getYLabel());
    }

    @Test
    @DisplayName("The renderer is not called when rendering is disabled")
    void runFullAnalysis_renderingDisabled_rendersNothing() {
        service.runFullAnalysis(unitAreaMeasurement(DENSITY), linearConfig);

        verify(renderer, never()).render(any());
    }

    @Test
    @DisplayName("Too few samples and empty windows propagate as insufficient data")
    void runFullAnalysis_insufficientData_throws() {
        IvMeasurement single = new IvMeasurement("single", new double[]{0.5, 0.5}, new double[]{1.0, 2.0}, 1.0);
        assertThrows(InsufficientDataException.class, () -> service.runFullAnalysis(single, linearConfig));

        AnalysisConfiguration noSeriesWindow = linearConfig.withHighVoltageFactor(null).withVoltageLimits(0.1, 0.9);
        assertThrows(InsufficientDataException.class,
                () -> service.runFullAnalysis(unitAreaMeasurement(DENSITY), noSeriesWindow));
    }

    @Test
    @DisplayName("Density resampling without area fails clearly")
    void resampleDensity_withoutArea_throws() {
        IvMeasurement measurement = new IvMeasurement("no-area", VOLTAGE, DENSITY, null);

        assertThrows(IllegalStateException.class, () -> service.resampleDensity(measurement, linearConfig));
    }

    @Test
    @DisplayName("High voltage limit: factor times Voc, else the absolute limit")
    void highVoltageLimit_selection() {
        AnalysisConfiguration absolute = AnalysisConfiguration.defaults().withVoltageLimits(0.1, 0.7);

        assertEquals(0.7, IvAnalysisService.highVoltageLimit(absolute, 0.8), 0.0);
        assertEquals(0.72, IvAnalysisService.highVoltageLimit(absolute.withHighVoltageFactor(0.9), 0.8), 1e-12);
        assertEquals(0.7, IvAnalysisService.highVoltageLimit(absolute.withHighVoltageFactor(0.9), Double.NaN), 0.0);
    }
}
