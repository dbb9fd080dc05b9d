package io.evpipelines.fisheries.rules;

import io.evpipelines.fisheries.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnTypeTest {

    @Test
    void integers() {
        assertEquals(2021L, ColumnType.parseInteger("2021").getAsLong());
        assertEquals(2021L, ColumnType.parseInteger(" 2021.0 ").getAsLong());
        assertTrue(ColumnType.parseInteger("2021.5").isEmpty());
        assertTrue(ColumnType.parseInteger("").isEmpty());
        assertTrue(ColumnType.parseInteger(null).isEmpty());
        assertTrue(ColumnType.parseInteger("abc").isEmpty());
    }

    @Test
    void reals() {
        assertEquals(-3.25, ColumnType.parseReal("-3.25").getAsDouble());
        assertEquals(10289.0, ColumnType.parseReal("10289").getAsDouble());
        assertTrue(ColumnType.parseReal("NaN").isEmpty());
        assertTrue(ColumnType.parseReal("$10,289").isEmpty());
        assertTrue(ColumnType.parseReal(" ").isEmpty());
    }

    @Test
    void conformance() {
        assertTrue(ColumnType.INTEGER.conforms("7"));
        assertFalse(ColumnType.INTEGER.conforms("7.1"));
        assertTrue(ColumnType.REAL.conforms("7.1"));
        assertTrue(ColumnType.STRING.conforms(""));
        assertFalse(ColumnType.STRING.conforms(null));
        assertTrue(ColumnType.STRING.numericValue("7").isEmpty());
    }

    @Test
    void fromName() {
        assertEquals(ColumnType.INTEGER, ColumnType.fromName("Integer"));
        assertEquals(ColumnType.REAL, ColumnType.fromName("float"));
        assertEquals(ColumnType.STRING, ColumnType.fromName("text"));
        assertThrows(ConfigurationException.class, () -> ColumnType.fromName("date"));
    }
}
