package org.tesis.solar;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SolarLayoutTest {

    @Test
    void areaArgument_parsedOrRejectedAsAParameterError() {
        assertEquals(120.5, SolarLayout.parseNumber("roofAreaM2", " 120.5 "));
        InvalidLayoutParamsException e = assertThrows(InvalidLayoutParamsException.class,
                () -> SolarLayout.parseNumber("roofAreaM2", "ciento"));
        assertTrue(e.getMessage().contains("roofAreaM2"));
    }

    @Test
    void optionalDimensions_blankMeansEstimate() {
        Properties props = new Properties();
        props.setProperty("roofLengthM", "12");
        props.setProperty("roofWidthM", " ");

        assertEquals(12.0, SolarLayout.optionalDouble(props, "roofLengthM"));
        assertNull(SolarLayout.optionalDouble(props, "roofWidthM"));
        props.setProperty("roofWidthM", "x");
        assertThrows(InvalidLayoutParamsException.class, () -> SolarLayout.optionalDouble(props, "roofWidthM"));
    }
}
