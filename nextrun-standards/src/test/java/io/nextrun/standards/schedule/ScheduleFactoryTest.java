package io.nextrun.standards.schedule;

import com.google.common.collect.ImmutableList;
import io.nextrun.client.config.ConfigException;
import io.nextrun.spi.CronSchedule;
import io.nextrun.spi.DaysSchedule;
import io.nextrun.spi.HoursSchedule;
import io.nextrun.spi.MinutesSchedule;
import io.nextrun.spi.MonthsSchedule;
import io.nextrun.spi.WeeksSchedule;
import org.junit.Test;

import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.WEDNESDAY;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ScheduleFactoryTest extends CalculatorTestHelper
{
    @Test
    public void minutes()
    {
        MinutesSchedule schedule = (MinutesSchedule) new MinutesScheduleFactory()
            .newSchedule(newConfig().set("minutesInterval", 5), 0);
        assertThat(schedule, is(MinutesSchedule.builder().minutesInterval(5).build()));
    }

    @Test(expected = ConfigException.class)
    public void minutesRequiresInterval()
    {
        new MinutesScheduleFactory().newSchedule(newConfig().set("type", "minutes"), 0);
    }

    @Test(expected = ConfigException.class)
    public void minutesIntervalMustBeWholeNumber()
    {
        new MinutesScheduleFactory().newSchedule(newConfig().set("minutesInterval", 5.7), 0);
    }

    @Test(expected = ConfigException.class)
    public void hourMustBeWholeNumber()
    {
        new DaysScheduleFactory().newSchedule(newConfig().set("hour", 9.5), 0);
    }

    @Test
    public void hoursDefaults()
    {
        HoursSchedule schedule = (HoursSchedule) new HoursScheduleFactory().newSchedule(newConfig(), 9);
        assertThat(schedule, is(HoursSchedule.builder().hoursInterval(1).minute(0).timezone(9).build()));
    }

    @Test
    public void zeroIntervalIsKept()
    {
        DaysSchedule schedule = (DaysSchedule) new DaysScheduleFactory()
            .newSchedule(newConfig().set("daysInterval", 0).set("hour", 9), 0);
        assertThat(schedule.getDaysInterval(), is(0));
        assertThat(schedule.getHour(), is(9));
        assertThat(schedule.getMinute(), is(0));
    }

    @Test
    public void weeks()
    {
        WeeksScheduleFactory factory = new WeeksScheduleFactory(configHelper);

        WeeksSchedule schedule = (WeeksSchedule) factory.newSchedule(newConfig()
                .set("weeksInterval", 2)
                .set("weekDays", ImmutableList.of("wednesday", "monday", "someday"))
                .set("hour", 9)
                .set("minute", 30), -3);
        assertThat(schedule.getWeeksInterval(), is(2));
        assertThat(schedule.getWeekDays(), is(ImmutableList.of(WEDNESDAY, MONDAY)));
        assertThat(schedule.getTimezone(), is(-3.0));

        WeeksSchedule defaults = (WeeksSchedule) factory.newSchedule(newConfig(), 0);
        assertThat(defaults.getWeekDays(), is(ImmutableList.of(MONDAY)));
    }

    @Test(expected = ConfigException.class)
    public void weekDaysMustBeArray()
    {
        new WeeksScheduleFactory(configHelper).newSchedule(newConfig().set("weekDays", newConfig().set("a", 1)), 0);
    }

    @Test
    public void monthsDefaults()
    {
        MonthsSchedule schedule = (MonthsSchedule) new MonthsScheduleFactory().newSchedule(newConfig().set("hour", 6), 0);
        assertThat(schedule, is(MonthsSchedule.builder().monthsInterval(1).dayOfMonth(1).hour(6).minute(0).build()));
    }

    @Test
    public void cronWithoutExpression()
    {
        CronSchedule schedule = (CronSchedule) new CronScheduleFactory().newSchedule(newConfig(), 0);
        assertThat(schedule.getCronExpression(), is(""));
    }
}
