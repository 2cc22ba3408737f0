package io.nextrun.standards.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.MonthsSchedule;

/**
 * Next trigger of a months schedule.
 *
 * Days past the end of a month spill over into the following month instead
 * of being clamped: this happens once when moving {@code monthsInterval}
 * months ahead with the current day of month, and again when setting
 * {@code dayOfMonth}. Day 31 in a 30-day month lands on the 1st of the next
 * month. The backend does the same arithmetic.
 */
public class MonthsNextTriggerCalculator
        extends BaseNextTriggerCalculator<MonthsSchedule>
{
    @Inject
    public MonthsNextTriggerCalculator(ScheduleConfigHelper configHelper)
    {
        super(configHelper);
    }

    @Override
    protected Optional<String> validate(MonthsSchedule schedule)
    {
        return configHelper.checkRange("monthsInterval", schedule.getMonthsInterval(), 1, 24)
            .or(configHelper.checkRange("dayOfMonth", schedule.getDayOfMonth(), 1, 31))
            .or(configHelper.checkHour(schedule.getHour()))
            .or(configHelper.checkMinute(schedule.getMinute()));
    }

    @Override
    protected Optional<LocalDateTime> next(MonthsSchedule schedule, LocalDateTime wallClock)
    {
        LocalDate today = wallClock.toLocalDate();
        LocalDate shifted = withDayOfMonthLenient(
                today.withDayOfMonth(1).plusMonths(schedule.getMonthsInterval()),
                today.getDayOfMonth());
        LocalDate day = withDayOfMonthLenient(shifted, schedule.getDayOfMonth());
        return Optional.of(day.atTime(schedule.getHour(), schedule.getMinute()));
    }

    static LocalDate withDayOfMonthLenient(LocalDate date, int dayOfMonth)
    {
        return date.withDayOfMonth(1).plusDays(dayOfMonth - 1);
    }
}
