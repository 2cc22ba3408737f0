package io.nextrun.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface HoursSchedule
        extends ScheduleConfiguration
{
    int getHoursInterval();

    int getMinute();

    @Override
    default ScheduleType getType()
    {
        return ScheduleType.HOURS;
    }

    @Override
    default <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    static ImmutableHoursSchedule.Builder builder()
    {
        return ImmutableHoursSchedule.builder();
    }
}
