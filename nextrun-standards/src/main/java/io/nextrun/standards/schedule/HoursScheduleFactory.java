package io.nextrun.standards.schedule;

import io.nextrun.client.config.Config;
import io.nextrun.spi.HoursSchedule;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.ScheduleType;

public class HoursScheduleFactory
        implements ScheduleFactory
{
    @Override
    public ScheduleType getType()
    {
        return ScheduleType.HOURS;
    }

    @Override
    public ScheduleConfiguration newSchedule(Config config, double timezone)
    {
        return HoursSchedule.builder()
            .hoursInterval(config.get("hoursInterval", int.class, 1))
            .minute(config.get("minute", int.class, 0))
            .timezone(timezone)
            .build();
    }
}
