package com.github.nikalon.sunposition;

import java.util.Locale;

public final class EquatorialCoordinate {
    // WARNING! No data validation is performed
    public final double rightAscension; // in hours, [0, 24)
    public final double declination;    // in degrees, [-90, 90]

    public EquatorialCoordinate(double rightAscension, double declination) {
        this.rightAscension = rightAscension;
        this.declination = declination;
    }

    public Sexagesimal rightAscensionHMS() {
        return Sexagesimal.fromDecimal(rightAscension);
    }

    public Sexagesimal declinationDMS() {
        return Sexagesimal.fromDecimal(declination);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "RA %s, Dec %s",
                rightAscensionHMS().rounded(2).formatHours(), declinationDMS().rounded(2).formatDegrees());
    }
}
