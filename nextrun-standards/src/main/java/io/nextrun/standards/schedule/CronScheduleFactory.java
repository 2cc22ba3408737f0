package io.nextrun.standards.schedule;

import io.nextrun.client.config.Config;
import io.nextrun.spi.CronSchedule;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.ScheduleType;

public class CronScheduleFactory
        implements ScheduleFactory
{
    @Override
    public ScheduleType getType()
    {
        return ScheduleType.CRON;
    }

    @Override
    public ScheduleConfiguration newSchedule(Config config, double timezone)
    {
        return CronSchedule.builder()
            .cronExpression(config.get("cronExpression", String.class, ""))
            .timezone(timezone)
            .build();
    }
}
