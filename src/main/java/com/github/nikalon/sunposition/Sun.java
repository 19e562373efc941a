package com.github.nikalon.sunposition;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Position of the Sun for a local date and time.
 */
public class Sun {
    private static final Logger LOGGER = Logger.getLogger(Sun.class.getName());

    // The epoch is January 0.0 2010
    static final double EPOCH_DAY = 0;
    static final int EPOCH_MONTH = 1;
    static final int EPOCH_YEAR = 2010;

    static final double TROPICAL_YEAR_DAYS = 365.242191;

    private static final int KEPLER_MAX_ITERATIONS = 50;
    private static final double KEPLER_TOLERANCE_RAD = 0.000001;

    private Sun() {} // Disallow instantiation

    static double daysSinceEpoch(double julianDate) {
        return julianDate - JulianDate.fromCivilDate(EPOCH_DAY, EPOCH_MONTH, EPOCH_YEAR);
    }

    // Mean motion of the Sun since the epoch, in degrees. Not reduced.
    static double meanMotion(double julianDate) {
        return 360.0 * daysSinceEpoch(julianDate) / TROPICAL_YEAR_DAYS;
    }

    public static double meanAnomaly(double julianDate, OrbitalElements elements) {
        double N = meanMotion(julianDate);
        return Helper.reduceDegrees(N + elements.meanEclipticLongitude - elements.perihelionLongitude);
    }

    public static double meanAnomaly(double julianDate) {
        return meanAnomaly(julianDate, OrbitalElements.epoch2010());
    }

    /**
     * First order equation of the centre, in degrees.
     *
     * @param meanAnomalyDeg mean anomaly in degrees
     * @param eccentricity   orbital eccentricity
     */
    public static double equationOfCenter(double meanAnomalyDeg, double eccentricity) {
        return 360.0 * eccentricity * Math.sin(Math.toRadians(meanAnomalyDeg)) / Math.PI;
    }

    public static double eclipticLongitude(double julianDate, OrbitalElements elements) {
        // TODO: Use TT (Terrestrial Time) for better accuracy when calculating the position of the Sun
        double N = meanMotion(julianDate);
        double M = meanAnomaly(julianDate, elements);
        double E = equationOfCenter(M, elements.eccentricity);
        double eclipticLongitude = Helper.reduceDegrees(N + E + elements.meanEclipticLongitude); // lambda

        LOGGER.fine(() -> String.format(Locale.ENGLISH, "JD %.6f: N=%.6f, M=%.6f, Ec=%.6f, lambda=%.6f",
                julianDate, N, M, E, eclipticLongitude));
        return eclipticLongitude;
    }

    public static double eclipticLongitude(double julianDate) {
        return eclipticLongitude(julianDate, OrbitalElements.epoch2010());
    }

    /**
     * Solves Kepler's equation for the eccentric anomaly and returns the true anomaly.
     *
     * @param meanAnomalyRad mean anomaly in radians
     * @param eccentricity   orbital eccentricity
     * @return true anomaly in radians
     */
    public static double trueAnomaly(double meanAnomalyRad, double eccentricity) {
        double M = Helper.modulo(meanAnomalyRad, 2 * Math.PI);
        double E = M;
        for (int i = 0; i < KEPLER_MAX_ITERATIONS; i++) {
            double residual = E - (eccentricity * Math.sin(E)) - M;
            if (Math.abs(residual) < KEPLER_TOLERANCE_RAD) {
                break;
            }
            E -= residual / (1.0 - (eccentricity * Math.cos(E)));
        }

        double a = Math.sqrt((1 + eccentricity) / (1 - eccentricity)) * Math.tan(E / 2);
        return 2.0 * Math.atan(a);
    }

    /**
     * Approximate position of the Sun, good to about 0.01 degrees. Uses the orbital elements of epoch 2010.0 and a
     * first order equation of the centre.
     */
    public static SunPosition approximatePositionOfSun(CivilDateTime local, TimeZoneContext zone) {
        GreenwichDateTime greenwich = TimeConverter.localCivilTimeToUniversalTime(local, zone);
        double sunEclipticLongitude = eclipticLongitude(greenwich.julianDate());
        EclipticCoordinate eclCoord = new EclipticCoordinate(0, sunEclipticLongitude);
        return new SunPosition(eclCoord.toEquatorial(greenwich.date));
    }

    public static SunPosition approximatePositionOfSun(double lctHours, double lctMinutes, double lctSeconds,
                                                       double localDay, int localMonth, int localYear,
                                                       boolean isDaylightSaving, int zoneCorrection) {
        CivilDateTime local = new CivilDateTime(localDay, localMonth, localYear, lctHours, lctMinutes, lctSeconds);
        return approximatePositionOfSun(local, new TimeZoneContext(zoneCorrection, isDaylightSaving));
    }

    /**
     * Precise position of the Sun, good to a few arcseconds.
     */
    public static SunPosition precisePositionOfSun(CivilDateTime local, TimeZoneContext zone) {
        GreenwichDateTime greenwich = TimeConverter.localCivilTimeToUniversalTime(local, zone);
        double sunEclipticLongitude = SunLongitudeSeries.eclipticLongitude(greenwich);
        EclipticCoordinate eclCoord = new EclipticCoordinate(0, sunEclipticLongitude);
        return new SunPosition(eclCoord.toEquatorial(greenwich.date));
    }

    public static SunPosition precisePositionOfSun(double lctHours, double lctMinutes, double lctSeconds,
                                                   double localDay, int localMonth, int localYear,
                                                   boolean isDaylightSaving, int zoneCorrection) {
        CivilDateTime local = new CivilDateTime(localDay, localMonth, localYear, lctHours, lctMinutes, lctSeconds);
        return precisePositionOfSun(local, new TimeZoneContext(zoneCorrection, isDaylightSaving));
    }
}
