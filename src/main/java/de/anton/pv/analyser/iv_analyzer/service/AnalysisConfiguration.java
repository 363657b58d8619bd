package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.algorithms.CurveInterpolator;
import de.anton.pv.analyser.iv_analyzer.algorithms.EfficiencyCalculator;
import de.anton.pv.analyser.iv_analyzer.algorithms.InterpolationMethod;
import de.anton.pv.analyser.iv_analyzer.algorithms.ResistanceExtractor;
import de.anton.pv.analyser.iv_analyzer.model.ValidationMode;

import java.util.Objects;

/**
 * Immutable configuration object holding all parameters for an analysis run.
 */
public record AnalysisConfiguration(
    int numPoints,                         // resampling grid size
    InterpolationMethod interpolationMethod,
    double lowVoltageLimit,                // V, shunt fit below
    double highVoltageLimit,               // V, series fit above, used when no factor applies
    Double highVoltageFactor,              // optional, series fit above factor * Voc
    double incidentPower,                  // mW/cm²
    ValidationMode validationMode,
    boolean renderCurves
) {

    public AnalysisConfiguration {
        Objects.requireNonNull(interpolationMethod, "Interpolation method cannot be null.");
        Objects.requireNonNull(validationMode, "Validation mode cannot be null.");
        if (numPoints < 2) {
            throw new IllegalArgumentException("Number of grid points must be at least 2, got: " + numPoints);
        }
        if (!Double.isFinite(lowVoltageLimit) || !Double.isFinite(highVoltageLimit)) {
            throw new IllegalArgumentException("Voltage limits must be finite: low=" + lowVoltageLimit + ", high=" + highVoltageLimit);
        }
        if (highVoltageFactor != null && !(highVoltageFactor > 0 && Double.isFinite(highVoltageFactor))) {
            throw new IllegalArgumentException("High voltage factor must be a positive number, got: " + highVoltageFactor);
        }
        if (!(incidentPower > 0) || !Double.isFinite(incidentPower)) {
            throw new IllegalArgumentException("Incident power must be positive, got: " + incidentPower);
        }
    }

    /** 1500 points, cubic, limits 0.1 V / 0.9 V, no factor, 100 mW/cm², permissive, no plots. */
    public static AnalysisConfiguration defaults() {
        return new AnalysisConfiguration(
                CurveInterpolator.DEFAULT_NUM_POINTS,
                InterpolationMethod.CUBIC,
                ResistanceExtractor.DEFAULT_LOW_VOLTAGE_LIMIT,
                ResistanceExtractor.DEFAULT_HIGH_VOLTAGE_LIMIT,
                null,
                EfficiencyCalculator.DEFAULT_INCIDENT_POWER,
                ValidationMode.PERMISSIVE,
                false);
    }

    public AnalysisConfiguration withNumPoints(int points) {
        return new AnalysisConfiguration(points, interpolationMethod, lowVoltageLimit, highVoltageLimit,
                highVoltageFactor, incidentPower, validationMode, renderCurves);
    }

    public AnalysisConfiguration withInterpolationMethod(InterpolationMethod method) {
        return new AnalysisConfiguration(numPoints, method, lowVoltageLimit, highVoltageLimit,
                highVoltageFactor, incidentPower, validationMode, renderCurves);
    }

    public AnalysisConfiguration withVoltageLimits(double low, double high) {
        return new AnalysisConfiguration(numPoints, interpolationMethod, low, high,
                highVoltageFactor, incidentPower, validationMode, renderCurves);
    }

    /** @param factor series window starts at factor * Voc; null to use the absolute limit. */
    public AnalysisConfiguration withHighVoltageFactor(Double factor) {
        return new AnalysisConfiguration(numPoints, interpolationMethod, lowVoltageLimit, highVoltageLimit,
                factor, incidentPower, validationMode, renderCurves);
    }

    public AnalysisConfiguration withIncidentPower(double power) {
        return new AnalysisConfiguration(numPoints, interpolationMethod, lowVoltageLimit, highVoltageLimit,
                highVoltageFactor, power, validationMode, renderCurves);
    }

    public AnalysisConfiguration withValidationMode(ValidationMode mode) {
        return new AnalysisConfiguration(numPoints, interpolationMethod, lowVoltageLimit, highVoltageLimit,
                highVoltageFactor, incidentPower, mode, renderCurves);
    }

    public AnalysisConfiguration withRenderCurves(boolean render) {
        return new AnalysisConfiguration(numPoints, interpolationMethod, lowVoltageLimit, highVoltageLimit,
                highVoltageFactor, incidentPower, validationMode, render);
    }
}
