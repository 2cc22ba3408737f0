package io.nextrun.standards.schedule;

import java.time.LocalDateTime;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.DaysSchedule;

public class DaysNextTriggerCalculator
        extends BaseNextTriggerCalculator<DaysSchedule>
{
    @Inject
    public DaysNextTriggerCalculator(ScheduleConfigHelper configHelper)
    {
        super(configHelper);
    }

    @Override
    protected Optional<String> validate(DaysSchedule schedule)
    {
        return configHelper.checkRange("daysInterval", schedule.getDaysInterval(), 1, 31)
            .or(configHelper.checkHour(schedule.getHour()))
            .or(configHelper.checkMinute(schedule.getMinute()));
    }

    @Override
    protected Optional<LocalDateTime> next(DaysSchedule schedule, LocalDateTime wallClock)
    {
        return Optional.of(wallClock
                .plusDays(schedule.getDaysInterval())
                .withHour(schedule.getHour())
                .withMinute(schedule.getMinute())
                .withSecond(0)
                .withNano(0));
    }
}
