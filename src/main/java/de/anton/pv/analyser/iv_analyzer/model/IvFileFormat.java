package de.anton.pv.analyser.iv_analyzer.model;

import java.util.Objects;

/**
 * Describes where the I-V columns live in a measurement file and which units they use.
 *
 * @param voltageColumn    header of the voltage column.
 * @param currentColumn    header of the current (or current density) column.
 * @param voltageUnit      unit of the voltage column.
 * @param currentUnit      unit of the current column.
 * @param areaCm2          cell area in cm², or null. Required for per-area current units.
 * @param delimiter        column separator of delimited text files.
 * @param decimalSeparator decimal separator of delimited text files.
 */
public record IvFileFormat(
    String voltageColumn,
    String currentColumn,
    VoltageUnit voltageUnit,
    CurrentUnit currentUnit,
    Double areaCm2,
    char delimiter,
    char decimalSeparator
) {
    public static final String DEFAULT_VOLTAGE_COLUMN = "Voltage (V)";
    public static final String DEFAULT_CURRENT_COLUMN = "Current (mA)";

    public IvFileFormat {
        Objects.requireNonNull(voltageColumn, "Voltage column name cannot be null.");
        Objects.requireNonNull(currentColumn, "Current column name cannot be null.");
        Objects.requireNonNull(voltageUnit, "Voltage unit cannot be null.");
        Objects.requireNonNull(currentUnit, "Current unit cannot be null.");
        if (areaCm2 != null && !(areaCm2 > 0)) {
            throw new IllegalArgumentException("Area must be a positive number of cm², got: " + areaCm2);
        }
        if (currentUnit.isPerArea() && areaCm2 == null) {
            throw new IllegalArgumentException("Area must be specified when using current density units.");
        }
        if (delimiter == decimalSeparator) {
            throw new IllegalArgumentException("Delimiter and decimal separator must differ: '" + delimiter + "'");
        }
    }

    /** Comma separated, dot decimals, V and mA, no area. */
    public static IvFileFormat defaults() {
        return new IvFileFormat(DEFAULT_VOLTAGE_COLUMN, DEFAULT_CURRENT_COLUMN,
                VoltageUnit.VOLT, CurrentUnit.MILLIAMPERE, null, ',', '.');
    }

    public IvFileFormat withColumns(String voltage, String current) {
        return new IvFileFormat(voltage, current, voltageUnit, currentUnit, areaCm2, delimiter, decimalSeparator);
    }

    public IvFileFormat withUnits(VoltageUnit voltage, CurrentUnit current) {
        return new IvFileFormat(voltageColumn, currentColumn, voltage, current, areaCm2, delimiter, decimalSeparator);
    }

    public IvFileFormat withArea(Double area) {
        return new IvFileFormat(voltageColumn, currentColumn, voltageUnit, currentUnit, area, delimiter, decimalSeparator);
    }

    public IvFileFormat withSeparators(char newDelimiter, char newDecimalSeparator) {
        return new IvFileFormat(voltageColumn, currentColumn, voltageUnit, currentUnit, areaCm2, newDelimiter, newDecimalSeparator);
    }
}
