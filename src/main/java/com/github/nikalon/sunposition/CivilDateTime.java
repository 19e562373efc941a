package com.github.nikalon.sunposition;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Local civil date and time as read from a wall clock.
 */
public final class CivilDateTime {
    // WARNING! No data validation is performed
    public final double day;
    public final int month;
    public final int year;
    public final double hour;
    public final double minute;
    public final double second;

    public CivilDateTime(double day, int month, int year, double hour, double minute, double second) {
        this.day = day;
        this.month = month;
        this.year = year;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
    }

    public static CivilDateTime of(LocalDateTime dateTime) {
        double second = dateTime.getSecond() + dateTime.getNano() / 1e9;
        return new CivilDateTime(dateTime.getDayOfMonth(), dateTime.getMonthValue(), dateTime.getYear(),
                dateTime.getHour(), dateTime.getMinute(), second);
    }

    public double decimalHours() {
        return TimeConverter.decimalHours(hour, minute, second);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s/%d/%d %s:%s:%s", day, month, year, hour, minute, second);
    }
}
