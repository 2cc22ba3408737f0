package io.nextrun.standards.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.nextrun.spi.WeeksSchedule;
import org.junit.Test;

import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SUNDAY;
import static java.time.DayOfWeek.WEDNESDAY;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class WeeksNextTriggerCalculatorTest extends CalculatorTestHelper
{
    private final WeeksNextTriggerCalculator calculator = new WeeksNextTriggerCalculator(configHelper);

    static WeeksSchedule every(int interval, int hour, int minute, DayOfWeek... days)
    {
        return WeeksSchedule.builder()
            .weeksInterval(interval)
            .weekDays(ImmutableList.copyOf(days))
            .hour(hour)
            .minute(minute)
            .build();
    }

    @Test
    public void startOfWeek()
    {
        // 2024-01-07 is a Sunday
        assertThat(WeeksNextTriggerCalculator.startOfWeek(LocalDate.of(2024, 1, 7)), is(LocalDate.of(2024, 1, 7)));
        assertThat(WeeksNextTriggerCalculator.startOfWeek(LocalDate.of(2024, 1, 8)), is(LocalDate.of(2024, 1, 7)));
        assertThat(WeeksNextTriggerCalculator.startOfWeek(LocalDate.of(2024, 1, 13)), is(LocalDate.of(2024, 1, 7)));
    }

    @Test
    public void firstConfiguredDayOfTheWeekAhead()
    {
        // 2024-01-03 is a Wednesday; one week ahead is the week of Sunday 2024-01-07
        assertThat(calculator.nextTrigger(every(1, 9, 30, MONDAY, WEDNESDAY), instant("2024-01-03 12:00:00 +0000")),
                is(at("2024-01-08 09:30:00 +0000")));

        // configured order doesn't matter
        assertThat(calculator.nextTrigger(every(1, 9, 30, FRIDAY, WEDNESDAY), instant("2024-01-03 12:00:00 +0000")),
                is(at("2024-01-10 09:30:00 +0000")));

        assertThat(calculator.nextTrigger(every(1, 0, 0, SUNDAY), instant("2024-01-06 23:00:00 +0000")),
                is(at("2024-01-07 00:00:00 +0000")));
    }

    @Test
    public void resultIsWithinTheTargetWeek()
    {
        // Sunday 2024-01-07 + 2 weeks = Sunday 2024-01-21
        assertThat(calculator.nextTrigger(every(2, 18, 0, SUNDAY, FRIDAY), instant("2024-01-07 20:00:00 +0000")),
                is(at("2024-01-21 18:00:00 +0000")));
        assertThat(calculator.nextTrigger(every(2, 18, 0, FRIDAY), instant("2024-01-07 20:00:00 +0000")),
                is(at("2024-01-26 18:00:00 +0000")));
    }

    @Test
    public void invalidSchedule()
    {
        assertThat(calculator.nextTrigger(every(1, 9, 0), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
        assertThat(calculator.checkSchedule(every(1, 9, 0)), is(Optional.of("weekDays must not be empty")));
        assertThat(calculator.nextTrigger(every(53, 9, 0, MONDAY), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
        assertThat(calculator.nextTrigger(every(1, 9, 60, MONDAY), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
    }
}
