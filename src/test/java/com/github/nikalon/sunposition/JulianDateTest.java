package com.github.nikalon.sunposition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class JulianDateTest {
    @Test
    void convertGreenwichToJulianDateTest() {
        assertEquals(2455002.25, JulianDate.fromCivilDate(19.75, 6, 2009));
        assertEquals(2458849.5, JulianDate.fromCivilDate(1, 1, 2020));
        assertEquals(2451545.0, JulianDate.fromCivilDate(1.5, 1, 2000));
    }

    @Test
    void epochShouldBeJanuaryZero2010Test() {
        assertEquals(2455196.5, JulianDate.fromCivilDate(0, 1, 2010));
    }

    @Test
    void julianCalendarDatesBeforeCutoverTest() {
        assertEquals(2299159.5, JulianDate.fromCivilDate(4, 10, 1582));
        // Origin of the Julian Date: noon of 4713 BC January 1, astronomical year -4712
        assertEquals(0.0, JulianDate.fromCivilDate(1.5, 1, -4712));
    }

    @Test
    void gregorianCutoverShouldFollowTheLastJulianDayTest() {
        // 1582 October 4 (Julian) was followed by 1582 October 15 (Gregorian)
        double lastJulian = JulianDate.fromCivilDate(4, 10, 1582);
        double firstGregorian = JulianDate.fromCivilDate(15, 10, 1582);
        assertEquals(2299160.5, firstGregorian);
        assertEquals(1.0, firstGregorian - lastJulian);
    }

    @Test
    void julianDateShouldIncreaseAcrossCutoverTest() {
        double[][] dates = {
                {1, 9, 1582}, {30, 9, 1582}, {1, 10, 1582}, {4, 10, 1582},
                {15, 10, 1582}, {16, 10, 1582}, {31, 10, 1582}, {1, 11, 1582}, {1, 1, 1583}
        };
        double previous = Double.NEGATIVE_INFINITY;
        for (double[] d : dates) {
            double jd = JulianDate.fromCivilDate(d[0], (int) d[1], (int) d[2]);
            assertTrue(jd > previous, String.format("JD of %s/%s/%s is not increasing", d[0], d[1], d[2]));
            previous = jd;
        }
    }

    @ParameterizedTest
    @CsvSource({
            "19.75, 6,  2009",
            "1.0,   1,  2020",
            "29.5,  2,  2000",
            "28.25, 2,  1900",
            "1.0,   3,  1900",
            "31.0,  12, 1999",
            "15.0,  10, 1582",
            "4.0,   10, 1582",
            "27.0,  7,  1988",
            "1.5,   1,  1000"
    })
    void civilDateRoundTripTest(double day, int month, int year) {
        CivilDate date = JulianDate.toCivilDate(JulianDate.fromCivilDate(day, month, year));
        assertEquals(day, date.day, 1e-9);
        assertEquals(month, date.month);
        assertEquals(year, date.year);
    }

    @Test
    void dayZeroShouldRollBackToPreviousMonthTest() {
        CivilDate date = JulianDate.toCivilDate(JulianDate.fromCivilDate(0, 1, 2010));
        assertEquals(new CivilDate(31, 12, 2009), date);
    }
}
