package de.anton.pv.analyser.iv_analyzer.algorithms;

import de.anton.pv.analyser.iv_analyzer.model.InsufficientDataException;
import de.anton.pv.analyser.iv_analyzer.model.MaximumPowerPoint;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Locates the maximum power point on a voltage / current density curve and derives the
 * fill factor from it.
 * With the usual sign convention the cell generates power where J < 0, so the point of
 * largest output is the most negative power density inside 0 <= V <= Voc.
 */
public final class MaximumPowerPointSolver {

    private static final Logger logger = LoggerFactory.getLogger(MaximumPowerPointSolver.class);

    private MaximumPowerPointSolver() { throw new IllegalStateException("Utility class"); }

    /**
     * Finds the sample with the minimum power density V * J among those with 0 <= V <= voc.
     * Ties go to the first sample in ascending voltage order. The curve is not modified.
     *
     * @param densityCurve resampled curve of current density (mA/cm²) over voltage (V).
     * @param voc          open-circuit voltage bounding the search window.
     * @return the located point.
     * @throws InsufficientDataException if no sample lies inside the window.
     */
    public static MaximumPowerPoint findMaximumPowerPoint(ResampledCurve densityCurve, double voc) {
        Objects.requireNonNull(densityCurve, "Curve cannot be null.");
        double[] voltage = densityCurve.getXValues();
        double[] density = densityCurve.getYValues();

        double[] power = new double[voltage.length];
        for (int i = 0; i < voltage.length; i++) {
            power[i] = voltage[i] * density[i];
        }

        int best = -1;
        int windowSize = 0;
        for (int i = 0; i < voltage.length; i++) {
            if (voltage[i] < 0 || voltage[i] > voc) continue;
            windowSize++;
            if (best == -1 || power[i] < power[best]) {
                best = i;
            }
        }
        if (best == -1) {
            throw new InsufficientDataException(String.format(
                "No data points found in the range 0 <= V <= Voc (Voc = %.4f V, curve spans [%.4f, %.4f] V).",
                voc, densityCurve.getMinX(), densityCurve.getMaxX()));
        }

        MaximumPowerPoint mpp = new MaximumPowerPoint(voltage[best], density[best], power[best], best);
        logger.debug("MPP found among {} window samples: V_mp={}, J_mp={}, P_mp={}",
                windowSize, mpp.voltage(), mpp.currentDensity(), mpp.powerDensity());
        return mpp;
    }

    /**
     * FF = |V_mp * J_mp / (voc * jsc)|. Non-negative by construction, not clamped to 1.
     */
    public static double fillFactor(MaximumPowerPoint mpp, double jsc, double voc) {
        Objects.requireNonNull(mpp, "Maximum power point cannot be null.");
        return Math.abs((mpp.voltage() * mpp.currentDensity()) / (voc * jsc));
    }

    /**
     * Locates the MPP in [0, voc] and returns the fill factor.
     *
     * @throws InsufficientDataException if no sample lies inside the window.
     */
    public static double fillFactor(ResampledCurve densityCurve, double jsc, double voc) {
        return fillFactor(findMaximumPowerPoint(densityCurve, voc), jsc, voc);
    }
}
