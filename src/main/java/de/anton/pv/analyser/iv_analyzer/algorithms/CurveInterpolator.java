package de.anton.pv.analyser.iv_analyzer.algorithms;

import de.anton.pv.analyser.iv_analyzer.model.InsufficientDataException;
import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import de.anton.pv.analyser.iv_analyzer.view.CurveRenderer;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw, unordered I-V samples into a smooth curve on an evenly spaced voltage grid.
 * Samples are stably sorted by x, duplicate x values keep the y of their first occurrence,
 * and the fitted function is evaluated at numPoints values from min(x) to max(x) inclusive.
 */
public final class CurveInterpolator {

    private static final Logger logger = LoggerFactory.getLogger(CurveInterpolator.class);

    public static final int DEFAULT_NUM_POINTS = 1500;

    private CurveInterpolator() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /** Resamples with default labels (voltage vs. current) and no rendering. */
    public static ResampledCurve interpolate(double[] xs, double[] ys, int numPoints, InterpolationMethod method) {
        return interpolate(xs, ys, numPoints, method, ResampledCurve.LABEL_VOLTAGE, ResampledCurve.LABEL_CURRENT, CurveRenderer.NONE);
    }

    /**
     * Resamples the samples onto a uniform grid.
     *
     * @param xs        independent values (voltage), finite, at least 2.
     * @param ys        dependent values (current or current density), same length as xs.
     * @param numPoints number of grid points, at least 2.
     * @param method    interpolation scheme.
     * @param xLabel    label of the x axis, carried on the result.
     * @param yLabel    label of the y axis, carried on the result.
     * @param renderer  receives the finished curve; use {@link CurveRenderer#NONE} to skip rendering.
     * @return the resampled curve.
     * @throws InsufficientDataException if there are fewer distinct x values than the method needs.
     * @throws IllegalArgumentException  for mismatched lengths, non-finite values or numPoints < 2.
     */
    public static ResampledCurve interpolate(double[] xs, double[] ys, int numPoints, InterpolationMethod method,
                                             String xLabel, String yLabel, CurveRenderer renderer) {
        Objects.requireNonNull(xs, "x values cannot be null.");
        Objects.requireNonNull(ys, "y values cannot be null.");
        Objects.requireNonNull(method, "Interpolation method cannot be null.");
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Length mismatch: " + xs.length + " != " + ys.length);
        }
        if (numPoints < 2) {
            throw new IllegalArgumentException("Number of grid points must be at least 2, got: " + numPoints);
        }
        for (int i = 0; i < xs.length; i++) {
            if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i])) {
                throw new IllegalArgumentException(String.format("Sample %d is not finite: (%s, %s)", i, xs[i], ys[i]));
            }
        }

        double[][] distinct = sortedDistinct(xs, ys);
        double[] xUnique = distinct[0];
        double[] yUnique = distinct[1];
        if (xUnique.length < 2) {
            throw new InsufficientDataException("At least 2 distinct x values are required for interpolation, got " + xUnique.length + ".");
        }
        if (xUnique.length < method.getMinimumPoints()) {
            throw new InsufficientDataException(String.format(
                "%s interpolation needs at least %d distinct points, got %d.", method, method.getMinimumPoints(), xUnique.length));
        }
        if (xUnique.length < xs.length) {
            logger.debug("Collapsed {} duplicate x value(s) before interpolation.", xs.length - xUnique.length);
        }

        UnivariateFunction function = method.fit(xUnique, yUnique);

        double min = xUnique[0];
        double max = xUnique[xUnique.length - 1];
        double[] grid = linspace(min, max, numPoints);
        double[] values = new double[numPoints];
        for (int i = 0; i < numPoints; i++) {
            values[i] = function.value(grid[i]);
        }
        ResampledCurve curve = new ResampledCurve(grid, values, xs, ys, xLabel, yLabel, method);
        logger.debug("Interpolated {} samples ({} distinct) to {} points over [{}, {}] using {}.",
                xs.length, xUnique.length, numPoints, min, max, method);

        render(curve, renderer);
        return curve;
    }

    /**
     * Stably sorts the pairs by x and drops every pair whose x equals the previous one.
     *
     * @return {x, y} of the remaining pairs, x strictly increasing.
     */
    static double[][] sortedDistinct(double[] xs, double[] ys) {
        List<Integer> order = new ArrayList<>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble(i -> xs[i])); // List.sort is stable

        double[] xOut = new double[xs.length];
        double[] yOut = new double[xs.length];
        int count = 0;
        for (int idx : order) {
            if (count > 0 && xs[idx] == xOut[count - 1]) {
                continue;
            }
            xOut[count] = xs[idx];
            yOut[count] = ys[idx];
            count++;
        }
        return new double[][]{Arrays.copyOf(xOut, count), Arrays.copyOf(yOut, count)};
    }

    /** numPoints evenly spaced values, first exactly min, last exactly max. */
    static double[] linspace(double min, double max, int numPoints) {
        double[] grid = new double[numPoints];
        double step = (max - min) / (numPoints - 1);
        for (int i = 0; i < numPoints - 1; i++) {
            grid[i] = Math.min(min + i * step, max);
        }
        grid[numPoints - 1] = max;
        return grid;
    }

    private static void render(ResampledCurve curve, CurveRenderer renderer) {
        if (renderer == null || renderer == CurveRenderer.NONE) {
            return;
        }
        try {
            renderer.render(curve);
        } catch (RuntimeException e) {
            logger.warn("Rendering of {} failed, continuing without plot: {}", curve.getYLabel(), e.getMessage(), e);
        }
    }
}
