package com.github.nikalon.sunposition;

/**
 * Obliquity of the ecliptic. All results are in degrees.
 */
public class Obliquity {
    private static final double JD_J2000 = 2451545.0;

    private Obliquity() {} // Disallow instantiation

    public static double meanObliquity(double julianDate) {
        // Julian centuries since J2000
        double T = (julianDate - JD_J2000) / 36525.0;
        double DE = T * (46.815 + T * (0.0006 - (T * 0.00181))) / 3600.0;
        return 23.43929167 - DE;
    }

    public static double nutationInObliquity(double julianDate) {
        // Julian centuries since 1900 January 0.5
        double T = (julianDate - OrbitalElements.JD_1900) / 36525.0;
        double T2 = T * T;

        double sunMeanLongitude = 279.6967 + 0.000303 * T2 + Helper.revolutions(100.0021358 * T);
        double L2 = 2 * Math.toRadians(sunMeanLongitude);

        double moonMeanLongitude = 270.4342 - 0.001133 * T2 + Helper.revolutions(1336.855231 * T);
        double D2 = 2 * Math.toRadians(moonMeanLongitude);

        double M1 = Math.toRadians(358.4758 - 0.00015 * T2 + Helper.revolutions(99.99736056 * T));  // Sun's mean anomaly
        double M2 = Math.toRadians(296.1046 + 0.009192 * T2 + Helper.revolutions(1325.552359 * T)); // Moon's mean anomaly
        double N1 = Math.toRadians(259.1833 + 0.002078 * T2 - Helper.revolutions(5.372616667 * T)); // Moon's ascending node
        double N2 = 2 * N1;

        double arcSeconds = (9.21 + 0.00091 * T) * Math.cos(N1);
        arcSeconds += (0.5522 - 0.00029 * T) * Math.cos(L2) - 0.0904 * Math.cos(N2);
        arcSeconds += 0.0884 * Math.cos(D2) + 0.0216 * Math.cos(L2 + M1);
        arcSeconds += 0.0183 * Math.cos(D2 - N1) + 0.0113 * Math.cos(D2 + M2);
        arcSeconds -= 0.0093 * Math.cos(L2 - M1) + 0.0066 * Math.cos(L2 - N1);
        return arcSeconds / 3600.0;
    }

    /**
     * True obliquity: mean obliquity plus nutation in obliquity.
     */
    public static double ofEcliptic(double julianDate) {
        return meanObliquity(julianDate) + nutationInObliquity(julianDate);
    }

    public static double ofEcliptic(double gDay, int gMonth, int gYear) {
        return ofEcliptic(JulianDate.fromCivilDate(gDay, gMonth, gYear));
    }
}
