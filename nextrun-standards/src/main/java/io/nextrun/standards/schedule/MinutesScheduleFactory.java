package io.nextrun.standards.schedule;

import io.nextrun.client.config.Config;
import io.nextrun.spi.MinutesSchedule;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.ScheduleType;

public class MinutesScheduleFactory
        implements ScheduleFactory
{
    @Override
    public ScheduleType getType()
    {
        return ScheduleType.MINUTES;
    }

    @Override
    public ScheduleConfiguration newSchedule(Config config, double timezone)
    {
        // no default interval; a minutes schedule without one has no next trigger
        return MinutesSchedule.builder()
            .minutesInterval(config.get("minutesInterval", int.class))
            .timezone(timezone)
            .build();
    }
}
