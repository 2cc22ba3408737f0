package io.nextrun.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface CronSchedule
        extends ScheduleConfiguration
{
    String getCronExpression();

    @Override
    default ScheduleType getType()
    {
        return ScheduleType.CRON;
    }

    @Override
    default <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    static ImmutableCronSchedule.Builder builder()
    {
        return ImmutableCronSchedule.builder();
    }
}
