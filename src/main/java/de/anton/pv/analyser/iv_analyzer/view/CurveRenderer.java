package de.anton.pv.analyser.iv_analyzer.view;

import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;

/**
 * Receives every curve the interpolator produces, e.g. to plot it.
 * Implementations may throw unchecked exceptions; the caller logs them and goes on.
 */
@FunctionalInterface
public interface CurveRenderer {

    /** Renders nothing. */
    CurveRenderer NONE = curve -> { };

    void render(ResampledCurve curve);
}
