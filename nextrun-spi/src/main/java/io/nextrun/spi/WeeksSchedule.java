package io.nextrun.spi;

import java.time.DayOfWeek;
import java.util.List;

import org.immutables.value.Value;

/**
 * Fires on the given week days every {@code weeksInterval} weeks.
 *
 * Week days keep the order they were configured in, which is the order they
 * are displayed in.
 */
@Value.Immutable
public interface WeeksSchedule
        extends ScheduleConfiguration
{
    int getWeeksInterval();

    List<DayOfWeek> getWeekDays();

    int getHour();

    int getMinute();

    @Override
    default ScheduleType getType()
    {
        return ScheduleType.WEEKS;
    }

    @Override
    default <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    static ImmutableWeeksSchedule.Builder builder()
    {
        return ImmutableWeeksSchedule.builder();
    }
}
