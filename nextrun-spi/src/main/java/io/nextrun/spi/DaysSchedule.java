package io.nextrun.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface DaysSchedule
        extends ScheduleConfiguration
{
    int getDaysInterval();

    int getHour();

    int getMinute();

    @Override
    default ScheduleType getType()
    {
        return ScheduleType.DAYS;
    }

    @Override
    default <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    static ImmutableDaysSchedule.Builder builder()
    {
        return ImmutableDaysSchedule.builder();
    }
}
