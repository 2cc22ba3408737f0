package io.nextrun.standards.schedule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.CronEvaluator;
import io.nextrun.spi.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CronNextTriggerCalculator
        extends BaseNextTriggerCalculator<CronSchedule>
{
    private static final Logger logger = LoggerFactory.getLogger(CronNextTriggerCalculator.class);

    private final CronEvaluator cronEvaluator;

    @Inject
    public CronNextTriggerCalculator(ScheduleConfigHelper configHelper, CronEvaluator cronEvaluator)
    {
        super(configHelper);
        this.cronEvaluator = cronEvaluator;
    }

    @Override
    protected Optional<String> validate(CronSchedule schedule)
    {
        Optional<String> blank = configHelper.checkNotBlank("cronExpression", schedule.getCronExpression());
        if (blank.isPresent()) {
            return blank;
        }
        return cronEvaluator.check(schedule.getCronExpression().trim());
    }

    @Override
    protected Optional<LocalDateTime> next(CronSchedule schedule, LocalDateTime wallClock)
    {
        Optional<Instant> next;
        try {
            next = cronEvaluator.evaluate(schedule.getCronExpression().trim(), wallClock.toInstant(ZoneOffset.UTC));
        }
        catch (RuntimeException ex) {
            logger.debug("Failed to evaluate cron expression '{}'", schedule.getCronExpression(), ex);
            return Optional.absent();
        }
        return next.transform(time -> LocalDateTime.ofInstant(time, ZoneOffset.UTC));
    }
}
