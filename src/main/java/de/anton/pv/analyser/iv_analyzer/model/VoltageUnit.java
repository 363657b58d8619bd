package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Voltage units accepted in measurement files. Values are normalized to volts.
 */
public enum VoltageUnit {
    VOLT("V", 1.0),
    MILLIVOLT("mV", 1e-3);

    private final String symbol;
    private final double factorToVolt;

    VoltageUnit(String symbol, double factorToVolt) {
        this.symbol = symbol;
        this.factorToVolt = factorToVolt;
    }

    /** Converts a raw value in this unit to volts. */
    public double toVolt(double value) {
        return value * factorToVolt;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Finds the unit for a tag such as "V" or "mV". The match is exact after trimming,
     * since "mV" and "MV" would mean different things.
     *
     * @throws IllegalArgumentException if the tag is unknown.
     */
    public static VoltageUnit fromSymbol(String symbol) {
        if (symbol != null) {
            for (VoltageUnit unit : values()) {
                if (unit.symbol.equals(symbol.trim())) {
                    return unit;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported voltage unit '" + symbol + "'. Use 'V' or 'mV'.");
    }
}
