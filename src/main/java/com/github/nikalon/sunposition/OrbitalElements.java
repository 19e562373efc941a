package com.github.nikalon.sunposition;

import java.util.Locale;

/**
 * Orbital elements of the Sun's apparent orbit at a given epoch. Angles are in degrees.
 */
public final class OrbitalElements {
    // Julian Date of 1900 January 0.5, origin of the element polynomials
    static final double JD_1900 = 2415020.0;

    public final double meanEclipticLongitude; // epsilon_g
    public final double perihelionLongitude;   // omega_g
    public final double eccentricity;          // e

    public OrbitalElements(double meanEclipticLongitude, double perihelionLongitude, double eccentricity) {
        this.meanEclipticLongitude = meanEclipticLongitude;
        this.perihelionLongitude = perihelionLongitude;
        this.eccentricity = eccentricity;
    }

    /**
     * Evaluates the elements at the given Greenwich date.
     */
    public static OrbitalElements atEpoch(double gDay, int gMonth, int gYear) {
        double T = (JulianDate.fromCivilDate(gDay, gMonth, gYear) - JD_1900) / 36525.0;
        double T2 = T * T;

        double longitude = Helper.reduceDegrees(279.6966778 + 36000.76892 * T + 0.0003025 * T2);
        double perihelion = Helper.reduceDegrees(281.2208444 + 1.719175 * T + 0.000452778 * T2);
        double eccentricity = 0.01675104 - 0.0000418 * T - 0.000000126 * T2;
        return new OrbitalElements(longitude, perihelion, eccentricity);
    }

    /**
     * Elements at epoch 2010.0 (January 0.0 2010). Evaluated on every call.
     */
    public static OrbitalElements epoch2010() {
        return atEpoch(Sun.EPOCH_DAY, Sun.EPOCH_MONTH, Sun.EPOCH_YEAR);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "longitude=%.6f, perihelion=%.6f, e=%.6f",
                meanEclipticLongitude, perihelionLongitude, eccentricity);
    }
}
