package com.github.nikalon.sunposition;

/**
 * Conversions between calendar dates and Julian Dates.
 */
public class JulianDate {
    // Julian Date of the first Gregorian day, 1582 October 15 at 00:00
    static final double GREGORIAN_CUTOVER = 2299160.5;

    private JulianDate() {} // Disallow instantiation

    private static boolean isGregorian(double day, int month, int year) {
        if (year != 1582) return year > 1582;
        if (month != 10)  return month > 10;
        return day >= 15;
    }

    /**
     * Converts a date to a Julian Date. Dates from 1582 October 15 onwards are taken as Gregorian, earlier dates as
     * Julian. The day may be fractional.
     */
    public static double fromCivilDate(double day, int month, int year) {
        int monthP = month;
        int yearP = year;

        if (month == 1 || month == 2) {
            monthP = month + 12;
            yearP = year - 1;
        }

        int B = 0;
        if (isGregorian(day, month, year)) {
            int A = (int) (yearP / 100.0);    // truncate integer part
            B = 2 - A + ((int) (A / 4.0));    // truncate integer part
        }

        int C;
        if (yearP < 0) C = (int) ((365.25 * yearP) - 0.75); // truncate integer part
        else           C = (int) (365.25 * yearP);          // truncate integer part

        int D = (int) (30.6001 * (monthP + 1)); // truncate integer part
        return B + C + D + day + 1720994.5;
    }

    /**
     * Converts a Julian Date back to a date. The returned day keeps the fraction of the day.
     */
    public static CivilDate toCivilDate(double julianDate) {
        double I = Math.floor(julianDate + 0.5);
        double F = julianDate + 0.5 - I;

        double B = I;
        if (I > GREGORIAN_CUTOVER - 0.5) {
            double A = Math.floor((I - 1867216.25) / 36524.25);
            B = I + 1 + A - Math.floor(A / 4);
        }

        double C = B + 1524;
        double D = Math.floor((C - 122.1) / 365.25);
        double E = Math.floor(365.25 * D);
        double G = Math.floor((C - E) / 30.6001);

        double day = C - E + F - Math.floor(30.6001 * G);
        int month = (int) (G < 13.5 ? G - 1 : G - 13);
        int year = (int) (month > 2 ? D - 4716 : D - 4715);
        return new CivilDate(day, month, year);
    }
}
