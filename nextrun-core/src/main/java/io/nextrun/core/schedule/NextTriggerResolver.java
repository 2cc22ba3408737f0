package io.nextrun.core.schedule;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.client.config.Config;
import io.nextrun.spi.CronSchedule;
import io.nextrun.spi.DaysSchedule;
import io.nextrun.spi.HoursSchedule;
import io.nextrun.spi.MinutesSchedule;
import io.nextrun.spi.MonthsSchedule;
import io.nextrun.spi.NextTriggerCalculator;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.WeeksSchedule;
import io.nextrun.standards.schedule.ScheduleConfigHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the next trigger time of a schedule trigger for display.
 *
 * A next trigger time computed by the backend always wins when it is given
 * and parses. Otherwise the time is calculated locally from the schedule,
 * which is a best-effort preview. Nothing here throws on bad input: an
 * unusable configuration resolves to absent.
 */
public class NextTriggerResolver
{
    private static final Logger logger = LoggerFactory.getLogger(NextTriggerResolver.class);

    private final ScheduleConfigurationManager configurationManager;
    private final ScheduleConfigHelper configHelper;
    private final Clock clock;
    private final NextTriggerCalculator<MinutesSchedule> minutes;
    private final NextTriggerCalculator<HoursSchedule> hours;
    private final NextTriggerCalculator<DaysSchedule> days;
    private final NextTriggerCalculator<WeeksSchedule> weeks;
    private final NextTriggerCalculator<MonthsSchedule> months;
    private final NextTriggerCalculator<CronSchedule> cron;

    @Inject
    public NextTriggerResolver(
            ScheduleConfigurationManager configurationManager,
            ScheduleConfigHelper configHelper,
            Clock clock,
            NextTriggerCalculator<MinutesSchedule> minutes,
            NextTriggerCalculator<HoursSchedule> hours,
            NextTriggerCalculator<DaysSchedule> days,
            NextTriggerCalculator<WeeksSchedule> weeks,
            NextTriggerCalculator<MonthsSchedule> months,
            NextTriggerCalculator<CronSchedule> cron)
    {
        this.configurationManager = configurationManager;
        this.configHelper = configHelper;
        this.clock = clock;
        this.minutes = minutes;
        this.hours = hours;
        this.days = days;
        this.weeks = weeks;
        this.months = months;
        this.cron = cron;
    }

    public Optional<Instant> computeNext(Config configuration, Optional<String> authoritativeNextTrigger)
    {
        return computeNext(configuration, authoritativeNextTrigger, clock.instant());
    }

    public Optional<Instant> computeNext(Config configuration, Optional<String> authoritativeNextTrigger, Instant now)
    {
        Optional<Instant> authoritative = parseAuthoritative(authoritativeNextTrigger);
        if (authoritative.isPresent()) {
            return authoritative;
        }

        Optional<ScheduleConfiguration> schedule = configurationManager.tryGetSchedule(configuration);
        if (!schedule.isPresent()) {
            return Optional.absent();
        }
        return calculate(schedule.get(), now);
    }

    public Optional<Instant> computeNext(ScheduleConfiguration schedule, Optional<String> authoritativeNextTrigger)
    {
        return computeNext(schedule, authoritativeNextTrigger, clock.instant());
    }

    public Optional<Instant> computeNext(ScheduleConfiguration schedule, Optional<String> authoritativeNextTrigger, Instant now)
    {
        Optional<Instant> authoritative = parseAuthoritative(authoritativeNextTrigger);
        if (authoritative.isPresent()) {
            return authoritative;
        }
        return calculate(schedule, now);
    }

    /**
     * Returns the reason the schedule has no locally calculated next trigger,
     * or absent if it is valid.
     */
    public Optional<String> checkSchedule(ScheduleConfiguration schedule)
    {
        return schedule.accept(new ScheduleConfiguration.Visitor<Optional<String>>() {
            @Override
            public Optional<String> visit(MinutesSchedule schedule)
            {
                return minutes.checkSchedule(schedule);
            }

            @Override
            public Optional<String> visit(HoursSchedule schedule)
            {
                return hours.checkSchedule(schedule);
            }

            @Override
            public Optional<String> visit(DaysSchedule schedule)
            {
                return days.checkSchedule(schedule);
            }

            @Override
            public Optional<String> visit(WeeksSchedule schedule)
            {
                return weeks.checkSchedule(schedule);
            }

            @Override
            public Optional<String> visit(MonthsSchedule schedule)
            {
                return months.checkSchedule(schedule);
            }

            @Override
            public Optional<String> visit(CronSchedule schedule)
            {
                return cron.checkSchedule(schedule);
            }
        });
    }

    private Optional<Instant> calculate(ScheduleConfiguration schedule, Instant now)
    {
        Optional<String> invalidTimezone = configHelper.checkTimezone(schedule.getTimezone());
        if (invalidTimezone.isPresent()) {
            logger.debug("Invalid {} schedule, no next trigger: {}", schedule.getType(), invalidTimezone.get());
            return Optional.absent();
        }

        Duration offset = timezoneOffset(schedule.getTimezone());
        Instant nowInZone = now.plus(offset);

        Optional<Instant> next = schedule.accept(new ScheduleConfiguration.Visitor<Optional<Instant>>() {
            @Override
            public Optional<Instant> visit(MinutesSchedule schedule)
            {
                return minutes.nextTrigger(schedule, nowInZone);
            }

            @Override
            public Optional<Instant> visit(HoursSchedule schedule)
            {
                return hours.nextTrigger(schedule, nowInZone);
            }

            @Override
            public Optional<Instant> visit(DaysSchedule schedule)
            {
                return days.nextTrigger(schedule, nowInZone);
            }

            @Override
            public Optional<Instant> visit(WeeksSchedule schedule)
            {
                return weeks.nextTrigger(schedule, nowInZone);
            }

            @Override
            public Optional<Instant> visit(MonthsSchedule schedule)
            {
                return months.nextTrigger(schedule, nowInZone);
            }

            @Override
            public Optional<Instant> visit(CronSchedule schedule)
            {
                return cron.nextTrigger(schedule, nowInZone);
            }
        });

        // calculators answer in the shifted frame
        return next.transform(time -> time.minus(offset));
    }

    static Optional<Instant> parseAuthoritative(Optional<String> value)
    {
        if (!value.isPresent()) {
            return Optional.absent();
        }
        try {
            return Optional.of(Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(value.get().trim())));
        }
        catch (DateTimeException ex) {
            logger.debug("Ignoring next trigger time that is not an ISO-8601 instant: '{}'", value.get());
            return Optional.absent();
        }
    }

    static Duration timezoneOffset(double hours)
    {
        return Duration.ofMillis(Math.round(hours * 3600000L));
    }
}
