package com.sitewatch.core.model;

public class ScheduleParseException extends RuntimeException {
    private final String schedule;

    public ScheduleParseException(String schedule, String message) {
        super(message);
        this.schedule = schedule;
    }

    public ScheduleParseException(String schedule, String message, Throwable cause) {
        super(message, cause);
        this.schedule = schedule;
    }

    public String schedule() {
        return schedule;
    }
}
