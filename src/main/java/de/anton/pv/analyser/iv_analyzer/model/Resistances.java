package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Series and shunt resistance from the two linear fits of an I-V curve, in ohms.
 * Signs are taken from the fitted slopes as-is.
 *
 * @param seriesResistance Rs, from the fit above the high voltage limit.
 * @param shuntResistance  Rsh, from the fit below the low voltage limit.
 * @param seriesFitPoints  number of samples in the series fit.
 * @param shuntFitPoints   number of samples in the shunt fit.
 */
public record Resistances(double seriesResistance, double shuntResistance, int seriesFitPoints, int shuntFitPoints) {
}
