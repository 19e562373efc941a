package com.github.nikalon.sunposition;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

class Configuration {
    static final String CONFIG_RESOURCE = "config.yml";

    private static final int ZONE_CORRECTION_MIN_VALUE = -12;
    private static final int ZONE_CORRECTION_MAX_VALUE = 14;
    private static final boolean DEBUG_MODE_DEFAULT = false;
    private static final boolean DAYLIGHT_SAVING_DEFAULT = false;
    private static final PositionModel MODEL_DEFAULT = PositionModel.APPROXIMATE;
    private static final Pattern REGEX_ZONE_CORRECTION = Pattern.compile("(?i)(?:UTC|GMT)?\\s*(?<hours>[+-]?\\d{1,2})");

    private final Logger logger;
    private String zone;
    private int zoneCorrectionHours;
    private boolean daylightSaving;
    private PositionModel model;
    private boolean debugMode;

    Configuration(Logger logger) {
        this.logger = logger;
        this.zone = "0";
        this.zoneCorrectionHours = 0;
        this.daylightSaving = DAYLIGHT_SAVING_DEFAULT;
        this.model = MODEL_DEFAULT;
        this.debugMode = DEBUG_MODE_DEFAULT;
    }

    static int getZoneCorrectionLowestValidValue() {
        return ZONE_CORRECTION_MIN_VALUE;
    }

    static int getZoneCorrectionHighestValidValue() {
        return ZONE_CORRECTION_MAX_VALUE;
    }

    /**
     * Reads the options of a YAML document. Missing options keep their current value, invalid ones are logged and
     * ignored.
     */
    void load(InputStream yamlStream) {
        Map<String, Object> values;
        try (yamlStream) {
            values = new Yaml().load(yamlStream);
        } catch (YAMLException | ClassCastException | IOException e) {
            logger.log(Level.SEVERE, String.format("Could not read %s, using default values", CONFIG_RESOURCE), e);
            return;
        }
        if (values == null) return; // Empty document

        // Debug mode
        Object debugVal = values.get("debug_mode");
        if (debugVal == null) {
            // Keep default value. No action is required.
        } else if (debugVal instanceof Boolean) {
            setDebugMode((Boolean) debugVal);
        } else {
            logger.severe(String.format("\"debug_mode\" value in %s is invalid, using default value. Please, use a boolean value (true or false).", CONFIG_RESOURCE));
        }

        // Time zone
        Object zoneVal = values.get("zone_correction");
        if (zoneVal != null && !setZone(String.valueOf(zoneVal))) {
            logger.severe(String.format("\"zone_correction\" value in %s is invalid, using UTC. Please, use \"auto\" or integer hours between %d and %d.", CONFIG_RESOURCE, ZONE_CORRECTION_MIN_VALUE, ZONE_CORRECTION_MAX_VALUE));
        }

        // Daylight saving
        Object dstVal = values.get("daylight_saving");
        if (dstVal == null) {
            // Keep default value. No action is required.
        } else if (dstVal instanceof Boolean) {
            setDaylightSaving((Boolean) dstVal);
        } else {
            logger.severe(String.format("\"daylight_saving\" value in %s is invalid, using default value. Please, use a boolean value (true or false).", CONFIG_RESOURCE));
        }

        // Model
        Object modelVal = values.get("model");
        if (modelVal != null && !setModel(String.valueOf(modelVal))) {
            logger.severe(String.format("\"model\" value in %s is invalid, using \"%s\". Please, use \"approximate\" or \"precise\".", CONFIG_RESOURCE, model.optionName()));
        }
    }

    String getZone() {
        return this.zone;
    }

    int getZoneCorrectionHours() {
        return this.zoneCorrectionHours;
    }

    boolean setZone(String newZone) {
        Integer hours = parseZoneOption(newZone);
        if (hours == null) {
            return false;
        }
        this.zone = newZone.trim();
        this.zoneCorrectionHours = hours;
        return true;
    }

    private Integer parseZoneOption(String zone) {
        if (zone == null) return null;
        String trimmed = zone.trim();

        if (trimmed.equals("auto")) {
            // Standard offset of the system time zone, without daylight saving. Fractional offsets are truncated.
            var standardOffset = ZoneId.systemDefault().getRules().getStandardOffset(Instant.now());
            return standardOffset.getTotalSeconds() / 3600;
        }

        Matcher matcher = REGEX_ZONE_CORRECTION.matcher(trimmed);
        if (matcher.matches()) {
            try {
                int hours = Integer.parseInt(matcher.group("hours"));
                if (hours >= ZONE_CORRECTION_MIN_VALUE && hours <= ZONE_CORRECTION_MAX_VALUE) {
                    return hours;
                }
            } catch (NumberFormatException e) {
                logger.fine(String.format("Invalid zone correction \"%s\": %s", zone, e.getMessage()));
            }
        }

        return null;
    }

    boolean getDaylightSaving() {
        return daylightSaving;
    }

    void setDaylightSaving(boolean daylightSaving) {
        this.daylightSaving = daylightSaving;
    }

    TimeZoneContext getTimeZoneContext() {
        return new TimeZoneContext(zoneCorrectionHours, daylightSaving);
    }

    PositionModel getModel() {
        return model;
    }

    boolean setModel(String name) {
        PositionModel newModel = PositionModel.fromName(name);
        if (newModel == null) {
            return false;
        }
        this.model = newModel;
        return true;
    }

    boolean getDebugMode() {
        return debugMode;
    }

    void setDebugMode(boolean mode) {
        this.debugMode = mode;
    }
}
