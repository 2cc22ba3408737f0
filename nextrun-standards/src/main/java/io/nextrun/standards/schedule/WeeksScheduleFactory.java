package io.nextrun.standards.schedule;

import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.nextrun.client.config.Config;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.ScheduleType;
import io.nextrun.spi.WeeksSchedule;

public class WeeksScheduleFactory
        implements ScheduleFactory
{
    private static final List<String> DEFAULT_WEEK_DAYS = ImmutableList.of("monday");

    private final ScheduleConfigHelper configHelper;

    @Inject
    public WeeksScheduleFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public ScheduleType getType()
    {
        return ScheduleType.WEEKS;
    }

    @Override
    public ScheduleConfiguration newSchedule(Config config, double timezone)
    {
        List<String> weekDays = config.get("weekDays", new TypeReference<List<String>>() {}, DEFAULT_WEEK_DAYS);

        return WeeksSchedule.builder()
            .weeksInterval(config.get("weeksInterval", int.class, 1))
            .weekDays(configHelper.parseWeekDays(weekDays))
            .hour(config.get("hour", int.class, 0))
            .minute(config.get("minute", int.class, 0))
            .timezone(timezone)
            .build();
    }
}
