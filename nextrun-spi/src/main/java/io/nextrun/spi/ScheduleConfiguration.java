package io.nextrun.spi;

import org.immutables.value.Value;

/**
 * A recurrence rule of a schedule trigger.
 *
 * Implementations are one of the six kinds below. Field ranges are not
 * enforced here; out-of-range values are representable and rejected when a
 * next trigger time is calculated.
 */
public interface ScheduleConfiguration
{
    ScheduleType getType();

    /**
     * Fixed UTC offset in hours, possibly fractional (e.g. 5.5).
     * No daylight saving time adjustment applies.
     */
    @Value.Default
    default double getTimezone()
    {
        return 0.0;
    }

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R>
    {
        R visit(MinutesSchedule schedule);

        R visit(HoursSchedule schedule);

        R visit(DaysSchedule schedule);

        R visit(WeeksSchedule schedule);

        R visit(MonthsSchedule schedule);

        R visit(CronSchedule schedule);
    }
}
