package de.anton.pv.analyser.iv_analyzer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link IvFileFormat} and the unit enums it carries.
 */
class IvFileFormatTest {

    @Test
    @DisplayName("Current density units need an area")
    void perAreaUnit_withoutArea_throws() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new IvFileFormat("V", "J", VoltageUnit.VOLT, CurrentUnit.MILLIAMPERE_PER_CM2, null, ',', '.'));
        assertEquals("Area must be specified when using current density units.", ex.getMessage());

        assertThrows(IllegalArgumentException.class, () -> CurrentUnit.AMPERE_PER_CM2.toMilliampere(1.0, null));
    }

    @Test
    @DisplayName("Area must be positive")
    void nonPositiveArea_throws() {
        assertThrows(IllegalArgumentException.class, () -> IvFileFormat.defaults().withArea(0.0));
        assertThrows(IllegalArgumentException.class, () -> IvFileFormat.defaults().withArea(-1.0));
        assertThrows(IllegalArgumentException.class, () -> new IvMeasurement("x", new double[]{0}, new double[]{0}, 0.0));
    }

    @Test
    @DisplayName("Delimiter and decimal separator must differ")
    void sameSeparators_throw() {
        assertThrows(IllegalArgumentException.class, () -> IvFileFormat.defaults().withSeparators(',', ','));
    }

    @Test
    @DisplayName("Unit tags are resolved, unknown tags rejected")
    void unitTags() {
        assertEquals(VoltageUnit.MILLIVOLT, VoltageUnit.fromSymbol("mV"));
        assertEquals(CurrentUnit.MILLIAMPERE_PER_CM2, CurrentUnit.fromSymbol("mA/cm²"));
        assertEquals(CurrentUnit.AMPERE, CurrentUnit.fromSymbol(" A "));
        assertThrows(IllegalArgumentException.class, () -> VoltageUnit.fromSymbol("kV"));
        assertThrows(IllegalArgumentException.class, () -> CurrentUnit.fromSymbol("uA"));
    }

    @Test
    @DisplayName("Unit conversions")
    void conversions() {
        assertEquals(0.25, VoltageUnit.MILLIVOLT.toVolt(250.0), 1e-12);
        assertEquals(1500.0, CurrentUnit.AMPERE.toMilliampere(1.5, null), 1e-12);
        assertEquals(3.0, CurrentUnit.MILLIAMPERE_PER_CM2.toMilliampere(6.0, 0.5), 1e-12);
        assertEquals(3.0, CurrentUnit.AMPERE_PER_CM2.toMilliampere(0.006, 0.5), 1e-12);
    }
}
