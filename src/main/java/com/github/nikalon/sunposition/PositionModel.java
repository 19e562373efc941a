package com.github.nikalon.sunposition;

import java.util.Locale;

enum PositionModel {
    APPROXIMATE {
        @Override
        SunPosition positionOfSun(CivilDateTime local, TimeZoneContext zone) {
            return Sun.approximatePositionOfSun(local, zone);
        }
    },
    PRECISE {
        @Override
        SunPosition positionOfSun(CivilDateTime local, TimeZoneContext zone) {
            return Sun.precisePositionOfSun(local, zone);
        }
    };

    abstract SunPosition positionOfSun(CivilDateTime local, TimeZoneContext zone);

    // Returns null for unknown names
    static PositionModel fromName(String name) {
        if (name == null) return null;
        switch (name.trim().toLowerCase(Locale.ENGLISH)) {
            case "approximate": return APPROXIMATE;
            case "precise":     return PRECISE;
            default:            return null;
        }
    }

    String optionName() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
