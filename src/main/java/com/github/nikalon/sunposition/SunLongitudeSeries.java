package com.github.nikalon.sunposition;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Ecliptic longitude of the Sun from a trigonometric series. Accurate to a few arcseconds, against roughly 0.01
 * degrees for {@link Sun#eclipticLongitude(double)}.
 */
class SunLongitudeSeries {
    private static final Logger LOGGER = Logger.getLogger(SunLongitudeSeries.class.getName());

    private SunLongitudeSeries() {} // Disallow instantiation

    static double eclipticLongitude(GreenwichDateTime greenwich) {
        // Julian centuries since 1900 January 0.5. 876600 is the number of hours in a Julian century.
        double T = (greenwich.date.julianDate() - OrbitalElements.JD_1900) / 36525.0
                + greenwich.universalTimeHours / 876600.0;
        double T2 = T * T;

        double L = 279.69668 + 0.0003025 * T2 + Helper.revolutions(100.0021359 * T);        // mean longitude
        double M1 = 358.47583 - (0.00015 + 0.0000033 * T) * T2 + Helper.revolutions(99.99736042 * T); // mean anomaly
        double e = 0.01675104 - 0.0000418 * T - 0.000000126 * T2;

        double trueAnomalyRad = Sun.trueAnomaly(Math.toRadians(M1), e);

        // Perturbations by Venus, Jupiter and the Moon, and a long period term
        double A = Math.toRadians(153.23 + Helper.revolutions(62.55209472 * T));
        double B = Math.toRadians(216.57 + Helper.revolutions(125.1041894 * T));
        double C = Math.toRadians(312.69 + Helper.revolutions(91.56766028 * T));
        double D = Math.toRadians(350.74 - 0.00144 * T2 + Helper.revolutions(1236.853095 * T));
        double E = Math.toRadians(231.19 + 20.2 * T);
        double perturbation = 0.00134 * Math.cos(A) + 0.00154 * Math.cos(B) + 0.002 * Math.cos(C)
                + 0.00179 * Math.sin(D) + 0.00178 * Math.sin(E);

        double longitudeRad = trueAnomalyRad + Math.toRadians(L - M1 + perturbation);
        double longitudeDeg = Helper.reduceDegrees(Math.toDegrees(longitudeRad));

        LOGGER.fine(() -> String.format(Locale.ENGLISH, "%s: T=%.9f, L=%.6f, M=%.6f, lambda=%.6f",
                greenwich, T, L, M1, longitudeDeg));
        return longitudeDeg;
    }
}
