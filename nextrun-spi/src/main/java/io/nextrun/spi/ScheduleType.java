package io.nextrun.spi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleType
{
    MINUTES("minutes"),
    HOURS("hours"),
    DAYS("days"),
    WEEKS("weeks"),
    MONTHS("months"),
    CRON("cron");

    private final String name;

    private ScheduleType(String name)
    {
        this.name = name;
    }

    @JsonCreator
    public static ScheduleType fromString(String name)
    {
        switch (name) {
        case "minutes":
            return MINUTES;
        case "hours":
            return HOURS;
        case "days":
            return DAYS;
        case "weeks":
            return WEEKS;
        case "months":
            return MONTHS;
        case "cron":
            return CRON;
        default:
            throw new IllegalArgumentException("Unknown schedule type: " + name);
        }
    }

    @JsonValue
    public String toString()
    {
        return name;
    }
}
