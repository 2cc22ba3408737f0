package io.nextrun.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface MonthsSchedule
        extends ScheduleConfiguration
{
    int getMonthsInterval();

    int getDayOfMonth();

    int getHour();

    int getMinute();

    @Override
    default ScheduleType getType()
    {
        return ScheduleType.MONTHS;
    }

    @Override
    default <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    static ImmutableMonthsSchedule.Builder builder()
    {
        return ImmutableMonthsSchedule.builder();
    }
}
