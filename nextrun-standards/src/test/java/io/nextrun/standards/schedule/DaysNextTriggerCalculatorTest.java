package io.nextrun.standards.schedule;

import com.google.common.base.Optional;
import io.nextrun.spi.DaysSchedule;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DaysNextTriggerCalculatorTest extends CalculatorTestHelper
{
    private final DaysNextTriggerCalculator calculator = new DaysNextTriggerCalculator(configHelper);

    static DaysSchedule every(int interval, int hour, int minute)
    {
        return DaysSchedule.builder().daysInterval(interval).hour(hour).minute(minute).build();
    }

    @Test
    public void nextTrigger()
    {
        assertThat(calculator.nextTrigger(every(1, 9, 0), instant("2024-01-01 08:00:00 +0000")),
                is(at("2024-01-02 09:00:00 +0000")));

        // never today even if the time of day is still ahead
        assertThat(calculator.nextTrigger(every(1, 23, 59), instant("2024-01-01 00:00:00 +0000")),
                is(at("2024-01-02 23:59:00 +0000")));

        assertThat(calculator.nextTrigger(every(31, 0, 0), instant("2024-02-15 12:34:56 +0000")),
                is(at("2024-03-17 00:00:00 +0000")));
    }

    @Test
    public void outOfRange()
    {
        assertThat(calculator.nextTrigger(every(32, 0, 0), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
        assertThat(calculator.nextTrigger(every(1, 24, 0), instant("2024-01-01 10:00:00 +0000")), is(Optional.absent()));
        assertThat(calculator.checkSchedule(every(0, 0, 0)), is(Optional.of("daysInterval must be between 1 and 31, got: 0")));
    }
}
