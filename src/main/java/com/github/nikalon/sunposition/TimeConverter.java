package com.github.nikalon.sunposition;

import java.util.logging.Logger;

/**
 * Converts local civil time into Greenwich date and Universal Time.
 */
public class TimeConverter {
    private static final Logger LOGGER = Logger.getLogger(TimeConverter.class.getName());

    private TimeConverter() {} // Disallow instantiation

    /**
     * Joins hours, minutes and seconds into decimal hours. If any component is negative the whole result is negative.
     */
    public static double decimalHours(double hours, double minutes, double seconds) {
        double a = Math.abs(seconds) / 60.0;
        double b = (Math.abs(minutes) + a) / 60.0;
        double c = Math.abs(hours) + b;
        return (hours < 0 || minutes < 0 || seconds < 0) ? -c : c;
    }

    public static GreenwichDateTime localCivilTimeToUniversalTime(CivilDateTime local, TimeZoneContext zone) {
        double universalTime = local.decimalHours() - zone.daylightSavingOffsetHours() - zone.zoneCorrectionHours;

        // Let the Julian Date carry the day overflow or underflow into the month and the year. Leap years come for free.
        // The calendar (Julian or Gregorian) is chosen by the local date, before the shift.
        double julianDate = JulianDate.fromCivilDate(local.day, local.month, local.year) + universalTime / 24.0;
        CivilDate greenwich = JulianDate.toCivilDate(julianDate);

        double wholeDay = Math.floor(greenwich.day);
        double utHours = 24.0 * (greenwich.day - wholeDay);
        GreenwichDateTime result = new GreenwichDateTime(new CivilDate(wholeDay, greenwich.month, greenwich.year), utHours);

        LOGGER.fine(() -> String.format("Local time %s (%s) is %s", local, zone, result));
        return result;
    }

    public static GreenwichDateTime localCivilTimeToUniversalTime(double lctHours, double lctMinutes, double lctSeconds,
                                                                  double localDay, int localMonth, int localYear,
                                                                  boolean isDaylightSaving, int zoneCorrection) {
        CivilDateTime local = new CivilDateTime(localDay, localMonth, localYear, lctHours, lctMinutes, lctSeconds);
        return localCivilTimeToUniversalTime(local, new TimeZoneContext(zoneCorrection, isDaylightSaving));
    }
}
