package de.anton.pv.analyser.iv_analyzer.algorithms;

/**
 * Power conversion efficiency from Voc, Jsc and FF.
 */
public final class EfficiencyCalculator {

    /** Standard test condition irradiance, AM1.5G, in mW/cm². */
    public static final double DEFAULT_INCIDENT_POWER = 100.0;

    private EfficiencyCalculator() { throw new IllegalStateException("Utility class"); }

    /** PCE in percent under {@value #DEFAULT_INCIDENT_POWER} mW/cm². */
    public static double pce(double ff, double voc, double jsc) {
        return pce(ff, voc, jsc, DEFAULT_INCIDENT_POWER);
    }

    /**
     * PCE = |voc * jsc * ff / incidentPower| * 100.
     *
     * @param ff            fill factor.
     * @param voc           open-circuit voltage in V.
     * @param jsc           short-circuit current density in mA/cm².
     * @param incidentPower incident light power density in mW/cm². Zero is not checked.
     * @return efficiency in percent.
     */
    public static double pce(double ff, double voc, double jsc, double incidentPower) {
        double outputPower = voc * jsc * ff; // mW/cm²
        return Math.abs(outputPower / incidentPower) * 100;
    }
}
