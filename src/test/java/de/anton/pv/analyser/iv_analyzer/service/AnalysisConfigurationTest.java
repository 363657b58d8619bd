package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.algorithms.InterpolationMethod;
import de.anton.pv.analyser.iv_analyzer.model.ValidationMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AnalysisConfiguration}.
 */
class AnalysisConfigurationTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        AnalysisConfiguration config = AnalysisConfiguration.defaults();

        assertEquals(1500, config.numPoints());
        assertEquals(InterpolationMethod.CUBIC, config.interpolationMethod());
        assertEquals(0.1, config.lowVoltageLimit(), 0.0);
        assertEquals(0.9, config.highVoltageLimit(), 0.0);
        assertNull(config.highVoltageFactor());
        assertEquals(100.0, config.incidentPower(), 0.0);
        assertEquals(ValidationMode.PERMISSIVE, config.validationMode());
        assertFalse(config.renderCurves());
    }

    @Test
    @DisplayName("with... methods change exactly one component")
    void withMethods() {
        AnalysisConfiguration base = AnalysisConfiguration.defaults();
        AnalysisConfiguration changed = base.withNumPoints(200).withIncidentPower(80.0);

        assertEquals(200, changed.numPoints());
        assertEquals(80.0, changed.incidentPower(), 0.0);
        assertEquals(base.interpolationMethod(), changed.interpolationMethod());
        assertEquals(1500, base.numPoints(), "The base configuration stays unchanged.");
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void invalidValues_throw() {
        AnalysisConfiguration base = AnalysisConfiguration.defaults();

        assertThrows(IllegalArgumentException.class, () -> base.withNumPoints(1));
        assertThrows(IllegalArgumentException.class, () -> base.withIncidentPower(0.0));
        assertThrows(IllegalArgumentException.class, () -> base.withHighVoltageFactor(-0.9));
        assertThrows(IllegalArgumentException.class, () -> base.withVoltageLimits(Double.NaN, 0.9));
        assertThrows(NullPointerException.class, () -> base.withValidationMode(null));
    }
}
