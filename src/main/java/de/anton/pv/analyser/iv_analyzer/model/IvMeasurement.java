package de.anton.pv.analyser.iv_analyzer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Unit-normalized I-V sweep of one cell: voltage in V, current in mA and, when the
 * cell area is known, current density in mA/cm².
 * Arrays are copied on the way in and on the way out, so instances are immutable.
 */
public final class IvMeasurement {

    private final String sourceName;
    private final double[] voltageV;
    private final double[] currentMA;
    private final double[] currentDensityMACm2; // null if no area was given
    private final Double areaCm2;

    /**
     * @param sourceName    file name or other label for log output, may be null.
     * @param voltageV      voltages in volts.
     * @param currentMA     currents in milliamps, same length as voltageV.
     * @param areaCm2       cell area in cm², or null. Current density is derived from it.
     */
    public IvMeasurement(String sourceName, double[] voltageV, double[] currentMA, Double areaCm2) {
        Objects.requireNonNull(voltageV, "Voltage values cannot be null.");
        Objects.requireNonNull(currentMA, "Current values cannot be null.");
        if (voltageV.length != currentMA.length) {
            throw new IllegalArgumentException(String.format(
                "Voltage and current must have the same length: %d != %d", voltageV.length, currentMA.length));
        }
        if (areaCm2 != null && !(areaCm2 > 0)) {
            throw new IllegalArgumentException("Area must be a positive number of cm², got: " + areaCm2);
        }
        this.sourceName = sourceName != null ? sourceName : "<unknown>";
        this.voltageV = voltageV.clone();
        this.currentMA = currentMA.clone();
        this.areaCm2 = areaCm2;
        if (areaCm2 != null) {
            double[] density = new double[currentMA.length];
            for (int i = 0; i < density.length; i++) {
                density[i] = currentMA[i] / areaCm2;
            }
            this.currentDensityMACm2 = density;
        } else {
            this.currentDensityMACm2 = null;
        }
    }

    // --- Getters ---
    public String getSourceName() { return sourceName; }
    public int size() { return voltageV.length; }
    public double[] getVoltageV() { return voltageV.clone(); }
    public double[] getCurrentMA() { return currentMA.clone(); }
    public Double getAreaCm2() { return areaCm2; }

    /** @return true if an area was given and current density is available. */
    public boolean hasCurrentDensity() {
        return currentDensityMACm2 != null;
    }

    /**
     * @return a copy of the current density in mA/cm².
     * @throws IllegalStateException if the measurement has no area.
     */
    public double[] getCurrentDensityMACm2() {
        if (currentDensityMACm2 == null) {
            throw new IllegalStateException("Measurement '" + sourceName + "' has no current density (no cell area given).");
        }
        return currentDensityMACm2.clone();
    }

    @Override
    public String toString() {
        return "IvMeasurement{" +
               "source=" + sourceName +
               ", points=" + voltageV.length +
               ", voltage=" + (voltageV.length > 5 ? Arrays.toString(Arrays.copyOf(voltageV, 5)) + "..." : Arrays.toString(voltageV)) +
               ", areaCm2=" + areaCm2 +
               '}';
    }
}
