package com.github.nikalon.sunposition;

import java.util.Locale;
import java.util.logging.Logger;

public final class EclipticCoordinate {
    private static final Logger LOGGER = Logger.getLogger(EclipticCoordinate.class.getName());

    // WARNING! No data validation is performed
    public final double latitude;  // beta, in degrees
    public final double longitude; // lambda, in degrees

    public EclipticCoordinate(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Rotates this coordinate into the equatorial frame using the obliquity of the ecliptic at the given Greenwich
     * date.
     */
    public EquatorialCoordinate toEquatorial(double gDay, int gMonth, int gYear) {
        double eclLatRad = Math.toRadians(this.latitude);
        double eclLongRad = Math.toRadians(this.longitude);

        double obliquityDeg = Obliquity.ofEcliptic(gDay, gMonth, gYear);
        double obliquityEclipticRad = Math.toRadians(obliquityDeg);

        // Conversion
        double sinDelta = Math.sin(eclLatRad) * Math.cos(obliquityEclipticRad) +
                          Math.cos(eclLatRad) * Math.sin(obliquityEclipticRad) * Math.sin(eclLongRad);
        double deltaDeg = Math.toDegrees(Helper.safeAsin(sinDelta));

        double y = Math.sin(eclLongRad) * Math.cos(obliquityEclipticRad) -
                   Math.tan(eclLatRad) * Math.sin(obliquityEclipticRad);
        double x = Math.cos(eclLongRad);
        double alphaDeg = Helper.reduceDegrees(Math.toDegrees(Math.atan2(y, x)));

        double alphaHours = alphaDeg / 15.0;
        LOGGER.fine(() -> String.format(Locale.ENGLISH, "Obliquity %.6f deg, %s -> RA %.6fh, Dec %.6f deg",
                obliquityDeg, this, alphaHours, deltaDeg));
        return new EquatorialCoordinate(alphaHours, deltaDeg);
    }

    public EquatorialCoordinate toEquatorial(CivilDate greenwichDate) {
        return toEquatorial(greenwichDate.day, greenwichDate.month, greenwichDate.year);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "lambda=%.6f, beta=%.6f", longitude, latitude);
    }
}
