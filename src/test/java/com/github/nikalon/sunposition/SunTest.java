package com.github.nikalon.sunposition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class SunTest {
    // Rounding used in the published results
    private static final double SECONDS_ERROR_MARGIN = 0.01;

    // The approximate model is good to about 0.01 degrees: 2.4 seconds of time, 36 arcseconds
    private static final double RA_AGREEMENT_HOURS = 3.0 / 60.0;
    private static final double DEC_AGREEMENT_DEGREES = 3.0 / 60.0;

    private static void assertSexagesimal(int unit, int minute, double second, Sexagesimal actual) {
        assertEquals(unit, actual.unit, "unit part of " + actual);
        assertEquals(minute, actual.minute, "minute part of " + actual);
        assertEquals(second, actual.second, SECONDS_ERROR_MARGIN, "second part of " + actual);
    }

    @Test
    void meanAnomalyAndEclipticLongitudeOn27July2003Test() {
        double jd = JulianDate.fromCivilDate(27, 7, 2003);
        assertEquals(201.159131, Sun.meanAnomaly(jd), 1e-6);
        assertEquals(123.580601, Sun.eclipticLongitude(jd), 1e-6);
    }

    @Test
    void injectedElementsShouldMatchDefaultEpochTest() {
        double jd = JulianDate.fromCivilDate(27, 7, 2003);
        assertEquals(Sun.eclipticLongitude(jd), Sun.eclipticLongitude(jd, OrbitalElements.epoch2010()));
    }

    @Test
    void equationOfCenterTest() {
        assertEquals(0.0, Sun.equationOfCenter(0.0, 0.016705), 1e-12);
        assertEquals(360.0 * 0.016705 / Math.PI, Sun.equationOfCenter(90.0, 0.016705), 1e-12);
        assertEquals(-360.0 * 0.016705 / Math.PI, Sun.equationOfCenter(270.0, 0.016705), 1e-12);
    }

    @Test
    void trueAnomalyTest() {
        assertEquals(0.0, Sun.trueAnomaly(0.0, 0.016705), 1e-12);
        assertEquals(Math.PI, Math.abs(Sun.trueAnomaly(Math.PI, 0.016705)), 1e-9);
        // A circular orbit has no equation of the centre
        assertEquals(1.0, Sun.trueAnomaly(1.0, 0.0), 1e-12);

        // The first order term is 2e sin(M)
        double M = Math.toRadians(90.0);
        assertEquals(2 * 0.016705, Sun.trueAnomaly(M, 0.016705) - M, 1e-3);
    }

    @ParameterizedTest
    @CsvSource({"1, 1, 1900", "1, 1, 1950", "1, 1, 2100", "1, 1, 1600", "1, 1, -500", "31, 12, 2399"})
    void anglesShouldStayInRangeFarFromEpochTest(double day, int month, int year) {
        double jd = JulianDate.fromCivilDate(day, month, year);
        double M = Sun.meanAnomaly(jd);
        double lambda = Sun.eclipticLongitude(jd);
        assertTrue(M >= 0.0 && M < 360.0, "Mean anomaly out of range: " + M);
        assertTrue(lambda >= 0.0 && lambda < 360.0, "Ecliptic longitude out of range: " + lambda);
    }

    @Test
    void approximatePositionOfSun27July2003Test() {
        SunPosition position = Sun.approximatePositionOfSun(0, 0, 0, 27, 7, 2003, false, 0);

        assertSexagesimal(8, 23, 33.73, position.rightAscension());
        assertSexagesimal(19, 21, 14.33, position.declination());
    }

    @Test
    void precisePositionOfSun27July1988Test() {
        SunPosition position = Sun.precisePositionOfSun(0, 0, 0, 27, 7, 1988, false, 0);

        assertSexagesimal(8, 26, 3.83, position.rightAscension());
        assertSexagesimal(19, 12, 49.72, position.declination());
    }

    @Test
    void approximatePositionOfSun1July2003Test() {
        SunPosition position = Sun.approximatePositionOfSun(0, 0, 0, 1, 7, 2003, false, 0);

        // Shortly after the June solstice: just past 6h of right ascension, close to the highest declination
        assertTrue(position.rightAscensionHours() > 6.5 && position.rightAscensionHours() < 6.75,
                "Unexpected right ascension " + position.rightAscension());
        assertTrue(position.declinationDegrees() > 23.0 + 5.0 / 60 && position.declinationDegrees() < 23.25,
                "Unexpected declination " + position.declination());
    }

    @Test
    void zoneCorrectionAndDaylightSavingShouldGiveSameInstantTest() {
        // 02:00 in zone +1 with daylight saving is 00:00 UT
        SunPosition local = Sun.approximatePositionOfSun(2, 0, 0, 27, 7, 2003, true, 1);
        SunPosition greenwich = Sun.approximatePositionOfSun(0, 0, 0, 27, 7, 2003, false, 0);
        assertEquals(greenwich.rightAscensionHours(), local.rightAscensionHours(), 1e-6);
        assertEquals(greenwich.declinationDegrees(), local.declinationDegrees(), 1e-6);
    }

    @Test
    void entryPointOverloadsShouldAgreeTest() {
        var local = CivilDateTime.of(LocalDateTime.of(1988, 7, 27, 0, 0));
        var zone = TimeZoneContext.utc();
        assertEquals(Sun.precisePositionOfSun(0, 0, 0, 27, 7, 1988, false, 0).rightAscensionHours(),
                Sun.precisePositionOfSun(local, zone).rightAscensionHours());
        assertEquals(Sun.approximatePositionOfSun(0, 0, 0, 27, 7, 1988, false, 0).declinationDegrees(),
                Sun.approximatePositionOfSun(local, zone).declinationDegrees());
    }

    @ParameterizedTest
    @CsvSource({
            "0,  27, 7,  2003",
            "0,  27, 7,  1988",
            "12, 1,  1,  2000",
            "6,  21, 3,  2015",
            "18, 22, 12, 2024",
            "0,  1,  7,  2003",
            "9,  5,  11, 1975"
    })
    void approximateAndPreciseModelsShouldAgreeTest(double hour, double day, int month, int year) {
        SunPosition approximate = Sun.approximatePositionOfSun(hour, 0, 0, day, month, year, false, 0);
        SunPosition precise = Sun.precisePositionOfSun(hour, 0, 0, day, month, year, false, 0);

        double raDifference = Math.abs(approximate.rightAscensionHours() - precise.rightAscensionHours());
        raDifference = Math.min(raDifference, 24.0 - raDifference); // Around 0h
        assertTrue(raDifference < RA_AGREEMENT_HOURS, "Right ascensions differ by " + raDifference + " hours");
        assertTrue(Math.abs(approximate.declinationDegrees() - precise.declinationDegrees()) < DEC_AGREEMENT_DEGREES);
    }

    @Test
    void preciseLongitudeOn27July1988Test() {
        GreenwichDateTime greenwich = new GreenwichDateTime(new CivilDate(27, 7, 1988), 0.0);
        assertEquals(124.187352, SunLongitudeSeries.eclipticLongitude(greenwich), 1e-5);
    }
}
