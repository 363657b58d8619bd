package de.anton.pv.analyser.iv_analyzer.model;

/**
 * How strictly extracted parameters are checked for physical plausibility.
 */
public enum ValidationMode {
    PERMISSIVE("Tolerant"),   // log implausible values, return them unchanged
    STRICT("Streng");         // reject implausible values

    private final String displayName;

    ValidationMode(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
