package de.anton.pv.analyser.iv_analyzer.model;

import de.anton.pv.analyser.iv_analyzer.algorithms.InterpolationMethod;

import java.util.Objects;

/**
 * A curve resampled onto an evenly spaced, strictly increasing x grid.
 * Besides the grid it keeps the raw samples it was built from, the axis labels and the
 * interpolation method, so renderers get everything they need from one object.
 * Immutable: all array accessors return copies.
 */
public final class ResampledCurve {

    public static final String LABEL_VOLTAGE = "Voltage (V)";
    public static final String LABEL_CURRENT = "Current (mA)";
    public static final String LABEL_CURRENT_DENSITY = "Current Density (mA/cm²)";

    private final double[] x;
    private final double[] y;
    private final double[] rawX;
    private final double[] rawY;
    private final String xLabel;
    private final String yLabel;
    private final InterpolationMethod method;

    public ResampledCurve(double[] x, double[] y, double[] rawX, double[] rawY,
                          String xLabel, String yLabel, InterpolationMethod method) {
        this.x = Objects.requireNonNull(x, "Grid x values cannot be null.").clone();
        this.y = Objects.requireNonNull(y, "Grid y values cannot be null.").clone();
        this.rawX = Objects.requireNonNull(rawX, "Raw x values cannot be null.").clone();
        this.rawY = Objects.requireNonNull(rawY, "Raw y values cannot be null.").clone();
        if (x.length != y.length || rawX.length != rawY.length) {
            throw new IllegalArgumentException("Curve columns must have matching lengths.");
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("A resampled curve needs at least 2 grid points, got: " + x.length);
        }
        this.xLabel = xLabel != null ? xLabel : LABEL_VOLTAGE;
        this.yLabel = yLabel != null ? yLabel : LABEL_CURRENT;
        this.method = Objects.requireNonNull(method, "Interpolation method cannot be null.");
    }

    // --- Grid ---
    public int size() { return x.length; }
    public double getX(int index) { return x[index]; }
    public double getY(int index) { return y[index]; }
    public double[] getXValues() { return x.clone(); }
    public double[] getYValues() { return y.clone(); }
    public double getMinX() { return x[0]; }
    public double getMaxX() { return x[x.length - 1]; }

    // --- Source samples, in input order ---
    public int rawSize() { return rawX.length; }
    public double[] getRawXValues() { return rawX.clone(); }
    public double[] getRawYValues() { return rawY.clone(); }

    // --- Metadata ---
    public String getXLabel() { return xLabel; }
    public String getYLabel() { return yLabel; }
    public InterpolationMethod getMethod() { return method; }

    /** Returns the grid column for the given axis (a copy). */
    public double[] column(CurveColumn column) {
        return column == CurveColumn.X ? getXValues() : getYValues();
    }

    @Override
    public String toString() {
        return String.format("ResampledCurve[%s vs %s, %d points over [%.4f, %.4f], %d raw samples, %s]",
                yLabel, xLabel, x.length, getMinX(), getMaxX(), rawX.length, method);
    }
}
