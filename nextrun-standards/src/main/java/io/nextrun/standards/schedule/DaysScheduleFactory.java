package io.nextrun.standards.schedule;

import io.nextrun.client.config.Config;
import io.nextrun.spi.DaysSchedule;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.ScheduleType;

public class DaysScheduleFactory
        implements ScheduleFactory
{
    @Override
    public ScheduleType getType()
    {
        return ScheduleType.DAYS;
    }

    @Override
    public ScheduleConfiguration newSchedule(Config config, double timezone)
    {
        return DaysSchedule.builder()
            .daysInterval(config.get("daysInterval", int.class, 1))
            .hour(config.get("hour", int.class, 0))
            .minute(config.get("minute", int.class, 0))
            .timezone(timezone)
            .build();
    }
}
