package com.github.nikalon.sunposition;

import java.util.Locale;

public final class TimeZoneContext {
    public final int zoneCorrectionHours;
    public final boolean daylightSaving;

    public TimeZoneContext(int zoneCorrectionHours, boolean daylightSaving) {
        this.zoneCorrectionHours = zoneCorrectionHours;
        this.daylightSaving = daylightSaving;
    }

    public static TimeZoneContext utc() {
        return new TimeZoneContext(0, false);
    }

    public int daylightSavingOffsetHours() {
        return daylightSaving ? 1 : 0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "UTC%+d%s", zoneCorrectionHours, daylightSaving ? " (DST)" : "");
    }
}
