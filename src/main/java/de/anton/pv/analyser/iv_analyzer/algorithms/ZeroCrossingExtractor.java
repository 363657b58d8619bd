package de.anton.pv.analyser.iv_analyzer.algorithms;

import de.anton.pv.analyser.iv_analyzer.model.CurveColumn;
import de.anton.pv.analyser.iv_analyzer.model.InsufficientDataException;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Reads Jsc and Voc off a resampled curve by piecewise-linear interpolation, extended
 * linearly past the ends of the curve when zero lies outside the sampled range.
 * The result is a first-order estimate, not an exact root.
 */
public final class ZeroCrossingExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ZeroCrossingExtractor.class);

    private ZeroCrossingExtractor() { throw new IllegalStateException("Utility class"); }

    /** Current density at zero voltage, in the curve's y unit. */
    public static double shortCircuitCurrentDensity(ResampledCurve densityCurve) {
        double jsc = crossing(densityCurve, CurveColumn.X, CurveColumn.Y);
        logger.debug("Jsc = {}", jsc);
        return jsc;
    }

    /** Voltage at zero current density, in V. */
    public static double openCircuitVoltage(ResampledCurve densityCurve) {
        double voc = crossing(densityCurve, CurveColumn.Y, CurveColumn.X);
        logger.debug("Voc = {}", voc);
        return voc;
    }

    /**
     * Value of the {@code to} column where the {@code from} column is zero.
     *
     * @throws InsufficientDataException if the from column has fewer than 2 distinct values.
     * @throws IllegalArgumentException  if from and to are the same column.
     */
    public static double crossing(ResampledCurve curve, CurveColumn from, CurveColumn to) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        if (from == to) {
            throw new IllegalArgumentException("From and to columns must differ, both are " + from);
        }
        return valueAt(curve.column(from), curve.column(to), 0.0);
    }

    /**
     * Linear interpolation of (from, to) at {@code target}, extrapolating from the first or
     * last segment outside the data range. Pairs are stably sorted by from; repeated from
     * values keep their first pair.
     */
    static double valueAt(double[] from, double[] to, double target) {
        double[][] distinct = CurveInterpolator.sortedDistinct(from, to);
        double[] distinctFrom = distinct[0];
        if (distinctFrom.length < 2) {
            throw new InsufficientDataException("At least 2 distinct values are required to locate a zero crossing, got " + distinctFrom.length + ".");
        }

        PolynomialSplineFunction line = new LinearInterpolator().interpolate(distinct[0], distinct[1]);
        if (line.isValidPoint(target)) {
            return line.value(target);
        }

        // Outside the knots: continue the outermost segment's polynomial.
        double[] knots = line.getKnots();
        PolynomialFunction[] segments = line.getPolynomials();
        if (target < knots[0]) {
            logger.debug("Extrapolating below the data range [{}, {}] to {}.", knots[0], knots[knots.length - 1], target);
            return segments[0].value(target - knots[0]);
        }
        logger.debug("Extrapolating above the data range [{}, {}] to {}.", knots[0], knots[knots.length - 1], target);
        int last = segments.length - 1;
        return segments[last].value(target - knots[last]);
    }
}
