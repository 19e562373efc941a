package com.github.nikalon.sunposition;

import java.io.InputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Hashtable;
import java.util.List;
import java.util.logging.Logger;

/**
 * Command line front end. Arguments come in pairs of parameter name and value, for example
 * {@code date 2003-07-27 time 00:00 zone +1 dst true model precise}. Parameters not given fall back to
 * {@code config.yml} and, for the date and time, to the system clock.
 */
public class SunPositionCommand {
    private static final String USAGE = "Usage: sunposition [date YYYY-MM-DD] [time HH:MM[:SS]] [zone auto|<hours>] [dst true|false] [model approximate|precise] [debugMode true|false]";

    private final Logger logger;
    private final PrintStream out;
    private final Configuration configuration;
    private final Hashtable<String, ParameterParser> commandParameters;
    private final Clock systemClock;

    private LocalDate date;
    private LocalTime time;

    SunPositionCommand(PrintStream out, Clock systemClock) {
        this.logger = Logger.getLogger(SunPositionCommand.class.getName());
        this.out = out;
        this.systemClock = systemClock;
        this.configuration = new Configuration(this.logger);

        commandParameters = new Hashtable<>();
        commandParameters.put("date", value -> parseDateParameter(value));
        commandParameters.put("time", value -> parseTimeParameter(value));
        commandParameters.put("zone", value -> parseZoneParameter(value));
        commandParameters.put("dst", value -> parseDaylightSavingParameter(value));
        commandParameters.put("model", value -> parseModelParameter(value));
        commandParameters.put("debugMode", value -> parseDebugModeParameter(value));
    }

    public static void main(String[] args) {
        var command = new SunPositionCommand(System.out, Clock.systemDefaultZone());
        InputStream config = SunPositionCommand.class.getClassLoader().getResourceAsStream(Configuration.CONFIG_RESOURCE);
        if (config != null) {
            command.configuration.load(config);
        }

        int status = command.run(List.of(args));
        if (status != 0) {
            System.exit(status);
        }
    }

    Configuration getConfiguration() {
        return configuration;
    }

    /**
     * Parses the arguments and prints the position of the Sun.
     *
     * @return 0 on success, 1 if an argument was invalid
     */
    int run(List<String> args) {
        if (args.size() % 2 != 0) {
            out.println(USAGE);
            return 1;
        }

        for (int i = 0; i < args.size(); i += 2) {
            var parameter = args.get(i);
            var parser = commandParameters.get(parameter);
            if (parser == null) {
                out.println(String.format("Unknown parameter \"%s\"", parameter));
                out.println(USAGE);
                return 1;
            }
            if (!parser.parse(args.get(i + 1))) {
                return 1;
            }
        }

        if (configuration.getDebugMode()) {
            logger.warning("debug mode is enabled. To disable it set the option \"debug_mode\" to false in config.yml or pass \"debugMode false\".");
        }

        var now = LocalDateTime.now(systemClock);
        var localDate = date != null ? date : now.toLocalDate();
        var localTime = time != null ? time : now.toLocalTime().withNano(0);
        var local = CivilDateTime.of(LocalDateTime.of(localDate, localTime));
        var zone = configuration.getTimeZoneContext();
        var model = configuration.getModel();
        debugLog(String.format("Local time %s %s (%s), %s model", localDate, localTime, zone, model.optionName()));

        if (configuration.getDebugMode()) {
            GreenwichDateTime greenwich = TimeConverter.localCivilTimeToUniversalTime(local, zone);
            debugLog(String.format("Greenwich date %s, Julian Date %.6f", greenwich, greenwich.julianDate()));
        }

        SunPosition position = model.positionOfSun(local, zone);
        debugLog(String.format("Right ascension %.9f h, declination %.9f deg", position.rightAscensionHours(), position.declinationDegrees()));

        out.println(String.format("Right ascension: %s", position.rightAscension().rounded(2).formatHours()));
        out.println(String.format("Declination:     %s", position.declination().rounded(2).formatDegrees()));
        return 0;
    }

    private boolean parseDateParameter(String value) {
        try {
            this.date = LocalDate.parse(value);
            return true;
        } catch (DateTimeException e) {
            out.println("Invalid date. Please, enter a date in the format YYYY-MM-DD");
            return false;
        }
    }

    private boolean parseTimeParameter(String value) {
        // A time in the format "HH:MM" or "HH:MM:SS"
        var parts = value.split(":");
        if (parts.length < 2 || parts.length > 3) {
            out.println("Invalid time. Please, enter a valid local time in the given 24-hour format: HH:MM or HH:MM:SS");
            return false;
        }

        try {
            var hour = Integer.parseInt(parts[0]);
            var minute = Integer.parseInt(parts[1]);

            // Seconds are optional
            var second = 0;
            if (parts.length == 3) {
                second = Integer.parseInt(parts[2]);
            }

            this.time = LocalTime.of(hour, minute, second);
            return true;
        } catch (NumberFormatException | DateTimeException e) {
            out.println("Invalid time. Please, enter a valid local time in the given 24-hour format: HH:MM or HH:MM:SS");
            return false;
        }
    }

    private boolean parseZoneParameter(String value) {
        if (configuration.setZone(value)) {
            return true;
        }
        out.println(String.format("Invalid zone correction. Please, enter \"auto\" or integer hours between %d and %d", Configuration.getZoneCorrectionLowestValidValue(), Configuration.getZoneCorrectionHighestValidValue()));
        return false;
    }

    private boolean parseDaylightSavingParameter(String value) {
        Boolean dst = parseBoolean(value);
        if (dst == null) {
            out.println("Invalid value. Please, enter a boolean value (true|false)");
            return false;
        }
        configuration.setDaylightSaving(dst);
        return true;
    }

    private boolean parseModelParameter(String value) {
        if (configuration.setModel(value)) {
            return true;
        }
        out.println("Invalid model. Please, enter \"approximate\" or \"precise\"");
        return false;
    }

    private boolean parseDebugModeParameter(String value) {
        Boolean debugMode = parseBoolean(value);
        if (debugMode == null) {
            out.println("Invalid value. Please, enter a boolean value (true|false)");
            return false;
        }
        configuration.setDebugMode(debugMode);
        return true;
    }

    private static Boolean parseBoolean(String value) {
        if (value.equals("true"))  return Boolean.TRUE;
        if (value.equals("false")) return Boolean.FALSE;
        return null;
    }

    private void debugLog(String message) {
        if (configuration.getDebugMode()) {
            logger.info(String.format("DEBUG: %s", message));
        }
    }

    private interface ParameterParser {
        boolean parse(String value);
    }
}
