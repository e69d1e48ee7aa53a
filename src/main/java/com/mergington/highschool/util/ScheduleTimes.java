package com.mergington.highschool.util;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Parsing of the 24-hour clock times used in activity schedules and filters.
 */
public final class ScheduleTimes {

    private static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter.ofPattern("H:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    // "24:00" closes the day; it sorts after every other HH:MM value
    private static final String END_OF_DAY = "24:00";
    private static final int MINUTES_PER_DAY = 24 * 60;

    private ScheduleTimes() {
    }

    /**
     * Converts "HH:MM" (or "H:MM") to minutes since midnight. "24:00" maps to 1440.
     *
     * @return the minute of day, or empty if the value is blank or not a valid clock time
     */
    public static Optional<Integer> toMinuteOfDay(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (END_OF_DAY.equals(trimmed)) {
            return Optional.of(MINUTES_PER_DAY);
        }
        try {
            LocalTime time = LocalTime.parse(trimmed, CLOCK_FORMAT);
            return Optional.of(time.getHour() * 60 + time.getMinute());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
