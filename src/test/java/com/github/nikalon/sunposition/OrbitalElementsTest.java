package com.github.nikalon.sunposition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

public class OrbitalElementsTest {
    @Test
    void elementsAtEpoch2010Test() {
        // Published values for epoch 2010.0
        OrbitalElements elements = OrbitalElements.epoch2010();
        assertEquals(279.557208, elements.meanEclipticLongitude, 1e-6);
        assertEquals(283.112438, elements.perihelionLongitude, 1e-6);
        assertEquals(0.016705, elements.eccentricity, 1e-6);
    }

    @Test
    void elementsShouldDependOnTheEpochTest() {
        OrbitalElements at1990 = OrbitalElements.atEpoch(0, 1, 1990);
        OrbitalElements at2010 = OrbitalElements.epoch2010();

        assertNotEquals(at2010.perihelionLongitude, at1990.perihelionLongitude);
        // Perihelion advances about 1.72 degrees per century
        assertEquals(0.3438, at2010.perihelionLongitude - at1990.perihelionLongitude, 1e-3);
        // Eccentricity decreases slowly
        assertEquals(0.0000418 * 0.2, at1990.eccentricity - at2010.eccentricity, 1e-7);
    }
}
