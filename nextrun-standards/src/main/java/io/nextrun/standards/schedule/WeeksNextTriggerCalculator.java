package io.nextrun.standards.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.WeeksSchedule;

/**
 * Next trigger of a weeks schedule.
 *
 * Moves {@code weeksInterval} weeks ahead, goes back to the Sunday starting
 * that week, and picks the first configured week day from there.
 */
public class WeeksNextTriggerCalculator
        extends BaseNextTriggerCalculator<WeeksSchedule>
{
    @Inject
    public WeeksNextTriggerCalculator(ScheduleConfigHelper configHelper)
    {
        super(configHelper);
    }

    @Override
    protected Optional<String> validate(WeeksSchedule schedule)
    {
        return configHelper.checkRange("weeksInterval", schedule.getWeeksInterval(), 1, 52)
            .or(configHelper.checkNotEmpty("weekDays", schedule.getWeekDays()))
            .or(configHelper.checkHour(schedule.getHour()))
            .or(configHelper.checkMinute(schedule.getMinute()));
    }

    @Override
    protected Optional<LocalDateTime> next(WeeksSchedule schedule, LocalDateTime wallClock)
    {
        Set<DayOfWeek> weekDays = EnumSet.copyOf(schedule.getWeekDays());

        LocalDate target = wallClock.toLocalDate().plusWeeks(schedule.getWeeksInterval());
        LocalDate sunday = startOfWeek(target);
        for (int i = 0; i < 7; i++) {
            LocalDate day = sunday.plusDays(i);
            if (weekDays.contains(day.getDayOfWeek())) {
                return Optional.of(day.atTime(schedule.getHour(), schedule.getMinute()));
            }
        }
        return Optional.absent();
    }

    static LocalDate startOfWeek(LocalDate date)
    {
        // DayOfWeek is 1 (Monday) to 7 (Sunday); weeks start on Sunday here
        return date.minusDays(date.getDayOfWeek().getValue() % 7);
    }
}
