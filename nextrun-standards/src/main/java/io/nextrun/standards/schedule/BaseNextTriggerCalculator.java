package io.nextrun.standards.schedule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import com.google.common.base.Optional;
import io.nextrun.spi.NextTriggerCalculator;
import io.nextrun.spi.ScheduleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class BaseNextTriggerCalculator<S extends ScheduleConfiguration>
        implements NextTriggerCalculator<S>
{
    private static final Logger logger = LoggerFactory.getLogger(BaseNextTriggerCalculator.class);

    protected final ScheduleConfigHelper configHelper;

    protected BaseNextTriggerCalculator(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public Optional<String> checkSchedule(S schedule)
    {
        return configHelper.checkTimezone(schedule.getTimezone())
            .or(validate(schedule));
    }

    @Override
    public Optional<Instant> nextTrigger(S schedule, Instant nowInZone)
    {
        Optional<String> invalid = checkSchedule(schedule);
        if (invalid.isPresent()) {
            logger.debug("Invalid {} schedule, no next trigger: {}", schedule.getType(), invalid.get());
            return Optional.absent();
        }

        LocalDateTime wallClock = LocalDateTime.ofInstant(nowInZone, ZoneOffset.UTC);
        return next(schedule, wallClock).transform(time -> time.toInstant(ZoneOffset.UTC));
    }

    /**
     * Returns the reason the schedule is rejected, or absent if it is valid.
     */
    protected abstract Optional<String> validate(S schedule);

    protected abstract Optional<LocalDateTime> next(S schedule, LocalDateTime wallClock);
}
