package io.nextrun.standards.schedule;

import java.time.DayOfWeek;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Locale.ENGLISH;

/**
 * Range checks and value parsing shared by schedule factories and calculators.
 *
 * Check methods return the reason a value is rejected, or absent if it is valid.
 */
public class ScheduleConfigHelper
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleConfigHelper.class);

    // same bounds as java.time.ZoneOffset
    static final double MAX_TIMEZONE_HOURS = 18.0;

    public Optional<String> checkRange(String key, int value, int min, int max)
    {
        if (value < min || value > max) {
            return Optional.of(String.format(ENGLISH, "%s must be between %d and %d, got: %d", key, min, max, value));
        }
        return Optional.absent();
    }

    public Optional<String> checkHour(int hour)
    {
        return checkRange("hour", hour, 0, 23);
    }

    public Optional<String> checkMinute(int minute)
    {
        return checkRange("minute", minute, 0, 59);
    }

    public Optional<String> checkTimezone(double timezone)
    {
        if (Double.isNaN(timezone) || Double.isInfinite(timezone)
                || timezone < -MAX_TIMEZONE_HOURS || timezone > MAX_TIMEZONE_HOURS) {
            return Optional.of("timezone must be an offset between -18 and 18 hours, got: " + timezone);
        }
        return Optional.absent();
    }

    public Optional<String> checkNotEmpty(String key, List<?> values)
    {
        if (values.isEmpty()) {
            return Optional.of(key + " must not be empty");
        }
        return Optional.absent();
    }

    public Optional<String> checkNotBlank(String key, String value)
    {
        if (value.trim().isEmpty()) {
            return Optional.of(key + " must not be empty");
        }
        return Optional.absent();
    }

    public List<DayOfWeek> parseWeekDays(List<String> names)
    {
        ImmutableList.Builder<DayOfWeek> builder = ImmutableList.builder();
        for (String name : names) {
            Optional<DayOfWeek> day = parseWeekDay(name);
            if (day.isPresent()) {
                builder.add(day.get());
            }
            else {
                logger.debug("Ignoring unknown week day: {}", name);
            }
        }
        return builder.build();
    }

    static Optional<DayOfWeek> parseWeekDay(String name)
    {
        if (name == null) {
            return Optional.absent();
        }
        switch (name.trim().toLowerCase(ENGLISH)) {
        case "monday":
            return Optional.of(DayOfWeek.MONDAY);
        case "tuesday":
            return Optional.of(DayOfWeek.TUESDAY);
        case "wednesday":
            return Optional.of(DayOfWeek.WEDNESDAY);
        case "thursday":
            return Optional.of(DayOfWeek.THURSDAY);
        case "friday":
            return Optional.of(DayOfWeek.FRIDAY);
        case "saturday":
            return Optional.of(DayOfWeek.SATURDAY);
        case "sunday":
            return Optional.of(DayOfWeek.SUNDAY);
        default:
            return Optional.absent();
        }
    }
}
