package com.github.nikalon.sunposition;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Objects;

/**
 * A decimal value in hours or degrees split into unit, minute and second parts. Only the unit carries the sign, the
 * minute and the second parts are always non-negative. The {@link #negative} flag keeps the sign of values between
 * -1 and 0, where the unit part is zero.
 */
public final class Sexagesimal {
    public final int unit;
    public final int minute;
    public final double second;
    public final boolean negative;

    private Sexagesimal(int unit, int minute, double second, boolean negative) {
        // Set as private constructor to disallow direct instantiation
        this.unit = unit;
        this.minute = minute;
        this.second = second;
        this.negative = negative;
    }

    public static Sexagesimal fromDecimal(double value) {
        boolean negative = value < 0;
        double magnitude = Math.abs(value);

        double units = Math.floor(magnitude);
        double minutes = (magnitude - units) * 60.0;
        double wholeMinutes = Math.floor(minutes);
        double seconds = (minutes - wholeMinutes) * 60.0;

        return of(negative, (int) units, (int) wholeMinutes, seconds);
    }

    /**
     * Builds a value from its parts. The value is negative when either {@code negative} is set or {@code unit} is
     * below zero.
     */
    public static Sexagesimal of(boolean negative, int unit, int minute, double second) {
        boolean isNegative = negative || unit < 0;
        int magnitude = Math.abs(unit);
        return new Sexagesimal(isNegative ? -magnitude : magnitude, minute, second, isNegative);
    }

    public double toDecimal() {
        double magnitude = Math.abs(unit) + minute / 60.0 + second / 3600.0;
        return negative ? -magnitude : magnitude;
    }

    /**
     * Rounds the second part to the given number of decimal places. A second part that rounds up to 60 is carried
     * into the minute, and a minute of 60 into the unit.
     */
    public Sexagesimal rounded(int places) {
        double scale = Math.pow(10, places);
        double roundedSecond = Math.round(second * scale) / scale;

        int newMinute = minute;
        int newUnit = Math.abs(unit);
        if (roundedSecond >= 60.0) {
            roundedSecond = 0.0;
            newMinute++;
        }
        if (newMinute >= 60) {
            newMinute = 0;
            newUnit++;
        }
        return of(negative, newUnit, newMinute, roundedSecond);
    }

    // Example: 08h 23m 33.73s
    public String formatHours() {
        return String.format(Locale.ENGLISH, "%s%02dh %02dm %ss", negative ? "-" : "", Math.abs(unit), minute, formatSecond());
    }

    // Example: +19° 21' 14.33"
    public String formatDegrees() {
        return String.format(Locale.ENGLISH, "%s%02d° %02d' %s\"", negative ? "-" : "+", Math.abs(unit), minute, formatSecond());
    }

    private String formatSecond() {
        var fmt = new DecimalFormat("00.00##", DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        return fmt.format(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sexagesimal)) return false;
        Sexagesimal other = (Sexagesimal) o;
        return unit == other.unit && minute == other.minute && Double.compare(second, other.second) == 0
                && negative == other.negative;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, minute, second, negative);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s%d %d %s", negative && unit == 0 ? "-" : "", unit, minute, second);
    }
}
