package de.anton.pv.analyser.iv_analyzer.algorithms;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.AkimaSplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;

/**
 * Supported 1-D interpolation schemes. Each constant fits strictly increasing (x, y)
 * pairs into a function that can be evaluated anywhere inside [x_first, x_last].
 */
public enum InterpolationMethod {
    LINEAR("linear", 2) {
        @Override
        UnivariateInterpolator newInterpolator() { return new LinearInterpolator(); }
    },
    /**
     * Natural cubic spline (second derivative zero at both ends). Inside the data it agrees
     * closely with a not-a-knot spline such as scipy's {@code interp1d(kind='cubic')}, but in the
     * first and last intervals the two can differ noticeably when the curve bends strongly there.
     */
    CUBIC("cubic", 4) {
        @Override
        UnivariateInterpolator newInterpolator() { return new SplineInterpolator(); }
    },
    AKIMA("akima", 5) {
        @Override
        UnivariateInterpolator newInterpolator() { return new AkimaSplineInterpolator(); }
    };

    private final String displayName;
    private final int minimumPoints;

    InterpolationMethod(String displayName, int minimumPoints) {
        this.displayName = displayName;
        this.minimumPoints = minimumPoints;
    }

    abstract UnivariateInterpolator newInterpolator();

    /**
     * Fits the given points.
     *
     * @param x strictly increasing abscissae, at least {@link #getMinimumPoints()} of them.
     * @param y ordinates, same length as x.
     * @return the fitted function.
     */
    public UnivariateFunction fit(double[] x, double[] y) {
        return newInterpolator().interpolate(x, y);
    }

    /** Smallest number of distinct points this scheme can be fitted to. */
    public int getMinimumPoints() {
        return minimumPoints;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds a method by its display name (case-insensitive), e.g. "cubic".
     *
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static InterpolationMethod fromDisplayName(String displayName) {
        if (displayName != null) {
            for (InterpolationMethod method : values()) {
                if (method.displayName.equalsIgnoreCase(displayName.trim())) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported interpolation method '" + displayName + "'. Use 'linear', 'cubic' or 'akima'.");
    }
}
