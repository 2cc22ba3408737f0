package io.nextrun.standards.schedule;

import io.nextrun.client.config.Config;
import io.nextrun.spi.MonthsSchedule;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.ScheduleType;

public class MonthsScheduleFactory
        implements ScheduleFactory
{
    @Override
    public ScheduleType getType()
    {
        return ScheduleType.MONTHS;
    }

    @Override
    public ScheduleConfiguration newSchedule(Config config, double timezone)
    {
        return MonthsSchedule.builder()
            .monthsInterval(config.get("monthsInterval", int.class, 1))
            .dayOfMonth(config.get("dayOfMonth", int.class, 1))
            .hour(config.get("hour", int.class, 0))
            .minute(config.get("minute", int.class, 0))
            .timezone(timezone)
            .build();
    }
}
