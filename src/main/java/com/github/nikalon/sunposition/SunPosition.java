package com.github.nikalon.sunposition;

/**
 * Right ascension and declination of the Sun, both as decimal values and split into sexagesimal parts.
 */
public final class SunPosition {
    public final EquatorialCoordinate equatorial;

    SunPosition(EquatorialCoordinate equatorial) {
        this.equatorial = equatorial;
    }

    public Sexagesimal rightAscension() {
        return equatorial.rightAscensionHMS();
    }

    public Sexagesimal declination() {
        return equatorial.declinationDMS();
    }

    public double rightAscensionHours() {
        return equatorial.rightAscension;
    }

    public double declinationDegrees() {
        return equatorial.declination;
    }

    @Override
    public String toString() {
        return equatorial.toString();
    }
}
