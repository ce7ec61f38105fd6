package com.sitewatch.core.model;

import java.util.Locale;

/**
 * When a site is checked. The string form is either {@code interval:<seconds>} or a standard
 * five-field cron expression ({@code minute hour day-of-month month day-of-week}).
 */
public sealed interface ScheduleSpec permits ScheduleSpec.Cron, ScheduleSpec.Interval {
    String INTERVAL_PREFIX = "interval:";
    String ANY = "*";

    /**
     * Parses the syntactic shape only. Field contents of a cron expression are validated when a
     * trigger is built from it.
     */
    static ScheduleSpec parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ScheduleParseException(raw, "Schedule is blank");
        }
        String trimmed = raw.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(INTERVAL_PREFIX)) {
            return Interval.parse(trimmed);
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new ScheduleParseException(raw, "Cron schedule needs 5 fields but has " + fields.length + ": " + raw);
        }
        return new Cron(fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    String expression();

    record Interval(long seconds) implements ScheduleSpec {
        public Interval {
            if (seconds <= 0) {
                throw new ScheduleParseException(INTERVAL_PREFIX + seconds, "Interval must be a positive number of seconds");
            }
        }

        private static Interval parse(String raw) {
            String value = raw.substring(INTERVAL_PREFIX.length()).trim();
            if (!value.matches("\\d+")) {
                throw new ScheduleParseException(raw, "Interval must be a positive integer: " + raw);
            }
            try {
                return new Interval(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ScheduleParseException(raw, "Interval out of range: " + raw, e);
            }
        }

        @Override
        public String expression() {
            return INTERVAL_PREFIX + seconds;
        }
    }

    record Cron(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) implements ScheduleSpec {
        @Override
        public String expression() {
            return String.join(" ", minute, hour, dayOfMonth, month, dayOfWeek);
        }

        /**
         * Standard cron matches a day when either day field matches, provided both are restricted.
         * A field starting with {@code *}, such as {@code *}{@code /2}, counts as unrestricted.
         */
        public boolean restrictsBothDayFields() {
            return !dayOfMonth.startsWith(ANY) && !dayOfWeek.startsWith(ANY);
        }

        public Cron withDayOfMonth(String value) {
            return new Cron(minute, hour, value, month, dayOfWeek);
        }

        public Cron withDayOfWeek(String value) {
            return new Cron(minute, hour, dayOfMonth, month, value);
        }
    }
}
