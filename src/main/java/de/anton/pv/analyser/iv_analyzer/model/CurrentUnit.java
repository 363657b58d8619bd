package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Current units accepted in measurement files. Values are normalized to milliamps;
 * the per-area units need the cell area to get there.
 */
public enum CurrentUnit {
    AMPERE("A", 1000.0, false),
    MILLIAMPERE("mA", 1.0, false),
    AMPERE_PER_CM2("A/cm2", 1000.0, true),
    MILLIAMPERE_PER_CM2("mA/cm2", 1.0, true);

    private final String symbol;
    private final double factorToMilliampere;
    private final boolean perArea;

    CurrentUnit(String symbol, double factorToMilliampere, boolean perArea) {
        this.symbol = symbol;
        this.factorToMilliampere = factorToMilliampere;
        this.perArea = perArea;
    }

    /**
     * Converts a raw value in this unit to milliamps.
     *
     * @param value   the raw value.
     * @param areaCm2 the cell area in cm², only read for per-area units (may be null otherwise).
     * @throws IllegalArgumentException if this is a per-area unit and no area is given.
     */
    public double toMilliampere(double value, Double areaCm2) {
        if (!perArea) {
            return value * factorToMilliampere;
        }
        if (areaCm2 == null) {
            throw new IllegalArgumentException("Area must be specified when using current density units.");
        }
        return value * areaCm2 * factorToMilliampere;
    }

    public boolean isPerArea() {
        return perArea;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Finds the unit for a tag such as "mA" or "A/cm2". "cm²" is accepted for "cm2".
     *
     * @throws IllegalArgumentException if the tag is unknown.
     */
    public static CurrentUnit fromSymbol(String symbol) {
        if (symbol != null) {
            String normalized = symbol.trim().replace('²', '2');
            for (CurrentUnit unit : values()) {
                if (unit.symbol.equals(normalized)) {
                    return unit;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported current unit '" + symbol + "'. Use 'A', 'mA', 'A/cm2', or 'mA/cm2'.");
    }
}
