package com.github.nikalon.sunposition;

import java.util.Locale;
import java.util.Objects;

/**
 * A calendar date whose day may be fractional. The fraction encodes the time of day, so 19.75 June 2009 is
 * 19 June 2009 at 18:00.
 */
public final class CivilDate {
    // WARNING! No data validation is performed
    public final double day;
    public final int month;
    public final int year;

    public CivilDate(double day, int month, int year) {
        this.day = day;
        this.month = month;
        this.year = year;
    }

    public double julianDate() {
        return JulianDate.fromCivilDate(day, month, year);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CivilDate)) return false;
        CivilDate other = (CivilDate) o;
        return Double.compare(day, other.day) == 0 && month == other.month && year == other.year;
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, month, year);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s/%d/%d", day, month, year);
    }
}
