package com.github.nikalon.sunposition;

import java.util.Locale;

/**
 * A Greenwich calendar date (integral day) together with the Universal Time of that day in decimal hours.
 */
public final class GreenwichDateTime {
    public final CivilDate date;
    public final double universalTimeHours;

    public GreenwichDateTime(CivilDate date, double universalTimeHours) {
        this.date = date;
        this.universalTimeHours = universalTimeHours;
    }

    public double julianDate() {
        return date.julianDate() + universalTimeHours / 24.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%d/%d/%d %.6fh UT", (int) date.day, date.month, date.year, universalTimeHours);
    }
}
