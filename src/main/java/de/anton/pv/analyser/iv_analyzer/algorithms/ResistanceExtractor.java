package de.anton.pv.analyser.iv_analyzer.algorithms;

import de.anton.pv.analyser.iv_analyzer.model.InsufficientDataException;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import de.anton.pv.analyser.iv_analyzer.model.Resistances;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.DoublePredicate;

/**
 * Estimates series and shunt resistance from the linear regions of a voltage / current curve.
 * <p>
 * Both branches regress current in A against voltage in V with ordinary least squares and
 * take the reciprocal of the slope. The sign is not altered, a curve with negative slope in
 * a window yields a negative resistance.
 * </p>
 */
public final class ResistanceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ResistanceExtractor.class);

    public static final double DEFAULT_LOW_VOLTAGE_LIMIT = 0.1;
    public static final double DEFAULT_HIGH_VOLTAGE_LIMIT = 0.9;

    private static final double MILLIAMPERE_PER_AMPERE = 1000.0;

    private ResistanceExtractor() { throw new IllegalStateException("Utility class"); }

    /** Extracts with the default limits of 0.1 V and 0.9 V. */
    public static Resistances extract(ResampledCurve currentCurve) {
        return extract(currentCurve, DEFAULT_LOW_VOLTAGE_LIMIT, DEFAULT_HIGH_VOLTAGE_LIMIT);
    }

    /**
     * Fits Rsh on the samples with V < lowVoltageLimit and Rs on the samples with V > highVoltageLimit.
     *
     * @param currentCurve     resampled curve of current (mA) over voltage (V).
     * @param lowVoltageLimit  upper bound (exclusive) of the shunt window.
     * @param highVoltageLimit lower bound (exclusive) of the series window.
     * @return Rs and Rsh in ohm, with the number of samples each fit used.
     * @throws InsufficientDataException if either window contains no samples.
     */
    public static Resistances extract(ResampledCurve currentCurve, double lowVoltageLimit, double highVoltageLimit) {
        Objects.requireNonNull(currentCurve, "Curve cannot be null.");
        double[] voltage = currentCurve.getXValues();
        double[] currentA = new double[currentCurve.size()];
        double[] currentMA = currentCurve.getYValues();
        for (int i = 0; i < currentA.length; i++) {
            currentA[i] = currentMA[i] / MILLIAMPERE_PER_AMPERE;
        }

        SimpleRegression shuntFit = fit(voltage, currentA, v -> v < lowVoltageLimit);
        if (shuntFit.getN() == 0) {
            throw new InsufficientDataException("No data points found for shunt resistance calculation in the specified voltage range.");
        }
        SimpleRegression seriesFit = fit(voltage, currentA, v -> v > highVoltageLimit);
        if (seriesFit.getN() == 0) {
            throw new InsufficientDataException("No data points found for series resistance calculation in the specified voltage range.");
        }

        double rsh = 1 / shuntFit.getSlope();
        double rs = 1 / seriesFit.getSlope();
        logger.debug("Shunt fit: n={}, slope={} S, R²={} -> Rsh={} Ohm", shuntFit.getN(), shuntFit.getSlope(), shuntFit.getRSquare(), rsh);
        logger.debug("Series fit: n={}, slope={} S, R²={} -> Rs={} Ohm", seriesFit.getN(), seriesFit.getSlope(), seriesFit.getRSquare(), rs);
        if (shuntFit.getN() < 2 || seriesFit.getN() < 2) {
            logger.warn("Resistance fit based on a single sample (shunt n={}, series n={}), slope is undefined.",
                    shuntFit.getN(), seriesFit.getN());
        }
        return new Resistances(rs, rsh, (int) seriesFit.getN(), (int) shuntFit.getN());
    }

    private static SimpleRegression fit(double[] voltage, double[] currentA, DoublePredicate inWindow) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < voltage.length; i++) {
            if (inWindow.test(voltage[i])) {
                regression.addData(voltage[i], currentA[i]);
            }
        }
        return regression;
    }
}
