package io.nextrun.spi;

import org.immutables.value.Value;

/**
 * Fires every {@code minutesInterval} minutes.
 */
@Value.Immutable
public interface MinutesSchedule
        extends ScheduleConfiguration
{
    int getMinutesInterval();

    @Override
    default ScheduleType getType()
    {
        return ScheduleType.MINUTES;
    }

    @Override
    default <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    static ImmutableMinutesSchedule.Builder builder()
    {
        return ImmutableMinutesSchedule.builder();
    }
}
