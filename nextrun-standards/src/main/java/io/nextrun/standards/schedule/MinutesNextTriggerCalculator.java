package io.nextrun.standards.schedule;

import java.time.LocalDateTime;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.MinutesSchedule;

/**
 * Next trigger of a minutes schedule, counted from now.
 *
 * The backend aligns minute intervals to the time the schedule was saved.
 * That reference is not available here, so the result only says "N minutes
 * from now" and may differ from the backend's value until it is pushed.
 */
public class MinutesNextTriggerCalculator
        extends BaseNextTriggerCalculator<MinutesSchedule>
{
    @Inject
    public MinutesNextTriggerCalculator(ScheduleConfigHelper configHelper)
    {
        super(configHelper);
    }

    @Override
    protected Optional<String> validate(MinutesSchedule schedule)
    {
        return configHelper.checkRange("minutesInterval", schedule.getMinutesInterval(), 1, 59);
    }

    @Override
    protected Optional<LocalDateTime> next(MinutesSchedule schedule, LocalDateTime wallClock)
    {
        return Optional.of(wallClock.plusMinutes(schedule.getMinutesInterval()));
    }
}
