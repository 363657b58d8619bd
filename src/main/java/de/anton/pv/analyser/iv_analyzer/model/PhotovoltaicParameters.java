package de.anton.pv.analyser.iv_analyzer.model;

import java.util.Objects;

/**
 * Figures of merit extracted from one I-V sweep.
 * The density based values (Jsc, Voc, FF, PCE and the MPP) are NaN when the measurement
 * had no cell area; {@link #hasDensityParameters()} tells the two cases apart.
 * This class is immutable.
 */
public final class PhotovoltaicParameters {

    private final double jscMACm2;   // short-circuit current density, sign as extrapolated
    private final double vocV;       // open-circuit voltage
    private final double fillFactor; // unitless, not clamped
    private final double pcePercent; // power conversion efficiency
    private final double rsOhm;      // series resistance
    private final double rshOhm;     // shunt resistance
    private final MaximumPowerPoint maximumPowerPoint; // null without density

    public PhotovoltaicParameters(double jscMACm2, double vocV, double fillFactor, double pcePercent,
                                  double rsOhm, double rshOhm, MaximumPowerPoint maximumPowerPoint) {
        this.jscMACm2 = jscMACm2;
        this.vocV = vocV;
        this.fillFactor = fillFactor;
        this.pcePercent = pcePercent;
        this.rsOhm = rsOhm;
        this.rshOhm = rshOhm;
        this.maximumPowerPoint = maximumPowerPoint;
    }

    /** Parameters of a measurement without current density: only the resistances are known. */
    public static PhotovoltaicParameters resistancesOnly(double rsOhm, double rshOhm) {
        return new PhotovoltaicParameters(Double.NaN, Double.NaN, Double.NaN, Double.NaN, rsOhm, rshOhm, null);
    }

    // --- Getters ---
    public double getJscMACm2() { return jscMACm2; }
    public double getVocV() { return vocV; }
    public double getFillFactor() { return fillFactor; }
    public double getPcePercent() { return pcePercent; }
    public double getRsOhm() { return rsOhm; }
    public double getRshOhm() { return rshOhm; }
    public MaximumPowerPoint getMaximumPowerPoint() { return maximumPowerPoint; }

    public boolean hasDensityParameters() {
        return maximumPowerPoint != null;
    }

    @Override
    public String toString() {
        return String.format(
            "PhotovoltaicParameters[Jsc=%.2f mA/cm², Voc=%.3f V, FF=%.4f, PCE=%.2f %%, Rs=%.2f Ω, Rsh=%.2f Ω]",
            Math.abs(jscMACm2), vocV, fillFactor, pcePercent, rsOhm, rshOhm);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhotovoltaicParameters that = (PhotovoltaicParameters) o;
        return Double.compare(that.jscMACm2, jscMACm2) == 0 &&
               Double.compare(that.vocV, vocV) == 0 &&
               Double.compare(that.fillFactor, fillFactor) == 0 &&
               Double.compare(that.pcePercent, pcePercent) == 0 &&
               Double.compare(that.rsOhm, rsOhm) == 0 &&
               Double.compare(that.rshOhm, rshOhm) == 0 &&
               Objects.equals(maximumPowerPoint, that.maximumPowerPoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jscMACm2, vocV, fillFactor, pcePercent, rsOhm, rshOhm, maximumPowerPoint);
    }
}
