package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Operating point with the largest generated power found on a resampled density curve.
 * Power density is negative in the generation quadrant.
 *
 * @param voltage        V_mp in V.
 * @param currentDensity J_mp in mA/cm².
 * @param powerDensity   V_mp * J_mp in mW/cm².
 * @param gridIndex      index of the point on the resampled grid.
 */
public record MaximumPowerPoint(double voltage, double currentDensity, double powerDensity, int gridIndex) {
}
