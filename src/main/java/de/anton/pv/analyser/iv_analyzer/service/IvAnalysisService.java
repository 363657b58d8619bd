package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.algorithms.CurveInterpolator;
import de.anton.pv.analyser.iv_analyzer.algorithms.EfficiencyCalculator;
import de.anton.pv.analyser.iv_analyzer.algorithms.MaximumPowerPointSolver;
import de.anton.pv.analyser.iv_analyzer.algorithms.ParameterValidator;
import de.anton.pv.analyser.iv_analyzer.algorithms.ResistanceExtractor;
import de.anton.pv.analyser.iv_analyzer.algorithms.ZeroCrossingExtractor;
import de.anton.pv.analyser.iv_analyzer.model.IvMeasurement;
import de.anton.pv.analyser.iv_analyzer.model.MaximumPowerPoint;
import de.anton.pv.analyser.iv_analyzer.model.PhotovoltaicParameters;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import de.anton.pv.analyser.iv_analyzer.model.Resistances;
import de.anton.pv.analyser.iv_analyzer.view.CurveRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Service responsible for the extraction pipeline of one measurement:
 * resampling, Jsc / Voc, MPP and fill factor, PCE, resistances and plausibility checks.
 * This class holds no state between runs.
 */
public class IvAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(IvAnalysisService.class);

    private final CurveRenderer curveRenderer;

    /**
     * Represents the result of a full analysis run.
     * The density curve is null when the measurement had no cell area.
     */
    public static class AnalysisResult {
        public final PhotovoltaicParameters parameters;
        public final ResampledCurve currentCurve;
        public final ResampledCurve densityCurve;
        public final Resistances resistances;

        AnalysisResult(PhotovoltaicParameters parameters, ResampledCurve currentCurve,
                       ResampledCurve densityCurve, Resistances resistances) {
            this.parameters = Objects.requireNonNull(parameters);
            this.currentCurve = Objects.requireNonNull(currentCurve);
            this.densityCurve = densityCurve;
            this.resistances = Objects.requireNonNull(resistances);
        }

        public boolean hasDensityCurve() {
            return densityCurve != null;
        }
    }

    public IvAnalysisService() {
        this(CurveRenderer.NONE);
    }

    /**
     * @param curveRenderer receives every resampled curve of a run whose configuration enables rendering.
     */
    public IvAnalysisService(CurveRenderer curveRenderer) {
        this.curveRenderer = Objects.requireNonNull(curveRenderer, "Renderer cannot be null, use CurveRenderer.NONE.");
    }

    /**
     * Executes the complete extraction pipeline.
     *
     * @param measurement samples in V and mA, with or without cell area.
     * @param config      grid, method, voltage limits, incident power and strictness.
     * @return parameters plus the resampled curves. Without area only Rs and Rsh are set.
     * @throws de.anton.pv.analyser.iv_analyzer.model.InsufficientDataException      if a curve or window holds too few samples.
     * @throws de.anton.pv.analyser.iv_analyzer.model.ImplausibleParameterException  in strict mode for implausible results.
     */
    public AnalysisResult runFullAnalysis(IvMeasurement measurement, AnalysisConfiguration config) {
        Objects.requireNonNull(measurement, "Measurement cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        logger.info("Service: Starting analysis of '{}' ({} samples, method={}, points={}, mode={}).",
                measurement.getSourceName(), measurement.size(), config.interpolationMethod(),
                config.numPoints(), config.validationMode());
        try {
            ResampledCurve currentCurve = resampleCurrent(measurement, config);

            ResampledCurve densityCurve = null;
            double jsc = Double.NaN;
            double voc = Double.NaN;
            double ff = Double.NaN;
            double pce = Double.NaN;
            MaximumPowerPoint mpp = null;
            if (measurement.hasCurrentDensity()) {
                densityCurve = resampleDensity(measurement, config);
                jsc = ZeroCrossingExtractor.shortCircuitCurrentDensity(densityCurve);
                voc = ZeroCrossingExtractor.openCircuitVoltage(densityCurve);
                mpp = MaximumPowerPointSolver.findMaximumPowerPoint(densityCurve, voc);
                ff = MaximumPowerPointSolver.fillFactor(mpp, jsc, voc);
                pce = EfficiencyCalculator.pce(ff, voc, jsc, config.incidentPower());
                logger.info("Service: Jsc={} mA/cm², Voc={} V, FF={}, PCE={} %", jsc, voc, ff, pce);
            } else {
                logger.info("Service: No cell area given for '{}', skipping Jsc, Voc, FF and PCE.", measurement.getSourceName());
            }

            double highLimit = highVoltageLimit(config, voc);
            Resistances resistances = ResistanceExtractor.extract(currentCurve, config.lowVoltageLimit(), highLimit);
            logger.info("Service: Rs={} Ohm ({} points above {} V), Rsh={} Ohm ({} points below {} V)",
                    resistances.seriesResistance(), resistances.seriesFitPoints(), highLimit,
                    resistances.shuntResistance(), resistances.shuntFitPoints(), config.lowVoltageLimit());

            PhotovoltaicParameters parameters = mpp != null
                    ? new PhotovoltaicParameters(jsc, voc, ff, pce, resistances.seriesResistance(), resistances.shuntResistance(), mpp)
                    : PhotovoltaicParameters.resistancesOnly(resistances.seriesResistance(), resistances.shuntResistance());
            ParameterValidator.validate(parameters, config.validationMode());

            logger.info("Service: Analysis of '{}' completed: {}", measurement.getSourceName(), parameters);
            return new AnalysisResult(parameters, currentCurve, densityCurve, resistances);
        } catch (RuntimeException e) {
            logger.error("Service: Error during analysis of '{}'", measurement.getSourceName(), e);
            throw e;
        }
    }

    /** Resamples current (mA) over voltage (V). */
    public ResampledCurve resampleCurrent(IvMeasurement measurement, AnalysisConfiguration config) {
        return CurveInterpolator.interpolate(measurement.getVoltageV(), measurement.getCurrentMA(),
                config.numPoints(), config.interpolationMethod(),
                ResampledCurve.LABEL_VOLTAGE, ResampledCurve.LABEL_CURRENT, rendererFor(config));
    }

    /**
     * Resamples current density (mA/cm²) over voltage (V).
     *
     * @throws IllegalStateException if the measurement has no cell area.
     */
    public ResampledCurve resampleDensity(IvMeasurement measurement, AnalysisConfiguration config) {
        return CurveInterpolator.interpolate(measurement.getVoltageV(), measurement.getCurrentDensityMACm2(),
                config.numPoints(), config.interpolationMethod(),
                ResampledCurve.LABEL_VOLTAGE, ResampledCurve.LABEL_CURRENT_DENSITY, rendererFor(config));
    }

    /** factor * Voc when both are known, the absolute limit otherwise. */
    static double highVoltageLimit(AnalysisConfiguration config, double voc) {
        if (config.highVoltageFactor() == null) {
            return config.highVoltageLimit();
        }
        if (Double.isNaN(voc)) {
            logger.warn("Service: High voltage factor {} needs Voc, which is unknown without cell area. Using {} V instead.",
                    config.highVoltageFactor(), config.highVoltageLimit());
            return config.highVoltageLimit();
        }
        return config.highVoltageFactor() * voc;
    }

    private CurveRenderer rendererFor(AnalysisConfiguration config) {
        return config.renderCurves() ? curveRenderer : CurveRenderer.NONE;
    }
}
