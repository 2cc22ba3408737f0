package io.nextrun.standards.schedule;

import com.google.common.base.Optional;
import io.nextrun.spi.MinutesSchedule;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class MinutesNextTriggerCalculatorTest extends CalculatorTestHelper
{
    private final MinutesNextTriggerCalculator calculator = new MinutesNextTriggerCalculator(configHelper);

    static MinutesSchedule every(int interval)
    {
        return MinutesSchedule.builder().minutesInterval(interval).build();
    }

    @Test
    public void addsIntervalWithoutAlignment()
    {
        assertThat(calculator.nextTrigger(every(5), instant("2024-01-01 10:00:00 +0000")),
                is(at("2024-01-01 10:05:00 +0000")));

        // seconds are kept
        assertThat(calculator.nextTrigger(every(15), instant("2024-01-01 10:07:42 +0000")),
                is(at("2024-01-01 10:22:42 +0000")));

        assertThat(calculator.nextTrigger(every(59), instant("2024-12-31 23:30:00 +0000")),
                is(at("2025-01-01 00:29:00 +0000")));
    }

    @Test
    public void intervalOutOfRange()
    {
        assertThat(calculator.nextTrigger(every(0), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
        assertThat(calculator.nextTrigger(every(60), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
        assertThat(calculator.checkSchedule(every(60)), is(Optional.of("minutesInterval must be between 1 and 59, got: 60")));
        assertThat(calculator.checkSchedule(every(1)), is(Optional.absent()));
    }

    @Test
    public void invalidTimezone()
    {
        MinutesSchedule schedule = MinutesSchedule.builder().minutesInterval(5).timezone(Double.NaN).build();
        assertThat(calculator.nextTrigger(schedule, instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
    }
}
