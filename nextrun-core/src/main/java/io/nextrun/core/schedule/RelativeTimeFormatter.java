package io.nextrun.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import com.google.common.base.Optional;

import static java.util.Locale.ENGLISH;

/**
 * Formats a next trigger time as a short hint relative to now.
 */
public class RelativeTimeFormatter
{
    public static final String NO_NEXT_TRIGGER = "-";
    public static final String TRIGGERING_SOON = "Triggering soon...";

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", ENGLISH);

    private static final long MINUTES_PER_HOUR = 60;
    private static final long MINUTES_PER_DAY = 24 * MINUTES_PER_HOUR;

    private final ZoneId displayZone;

    public RelativeTimeFormatter(ZoneId displayZone)
    {
        this.displayZone = displayZone;
    }

    public String format(Optional<Instant> next, Instant now)
    {
        if (!next.isPresent()) {
            return NO_NEXT_TRIGGER;
        }

        // an overdue preview is shown as imminent until a new value arrives
        long minutes = Math.floorDiv(next.get().toEpochMilli() - now.toEpochMilli(), 60000L);
        if (minutes <= 0) {
            return TRIGGERING_SOON;
        }
        if (minutes < MINUTES_PER_HOUR) {
            return "Next: in " + minutes + "m";
        }
        if (minutes < MINUTES_PER_DAY) {
            return "Next: in " + (minutes / MINUTES_PER_HOUR) + "h";
        }
        return formatTime(next.get());
    }

    public String formatTime(Instant instant)
    {
        return FORMATTER.withZone(displayZone).format(instant);
    }
}
