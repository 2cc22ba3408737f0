package io.nextrun.standards.schedule;

import java.time.LocalDateTime;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.HoursSchedule;

public class HoursNextTriggerCalculator
        extends BaseNextTriggerCalculator<HoursSchedule>
{
    @Inject
    public HoursNextTriggerCalculator(ScheduleConfigHelper configHelper)
    {
        super(configHelper);
    }

    @Override
    protected Optional<String> validate(HoursSchedule schedule)
    {
        return configHelper.checkRange("hoursInterval", schedule.getHoursInterval(), 1, 23)
            .or(configHelper.checkMinute(schedule.getMinute()));
    }

    @Override
    protected Optional<LocalDateTime> next(HoursSchedule schedule, LocalDateTime wallClock)
    {
        // at least one whole hour ahead, so setting the minute can't go back before now
        return Optional.of(wallClock
                .plusHours(schedule.getHoursInterval())
                .withMinute(schedule.getMinute())
                .withSecond(0)
                .withNano(0));
    }
}
