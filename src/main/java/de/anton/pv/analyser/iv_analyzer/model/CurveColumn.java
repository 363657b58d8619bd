package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Selects one of the two columns of a {@link ResampledCurve}.
 */
public enum CurveColumn {
    X,  // independent axis, voltage
    Y   // dependent axis, current or current density
}
