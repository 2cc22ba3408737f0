package io.nextrun.core.schedule;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.Lists;
import com.google.inject.Inject;
import io.nextrun.client.config.Config;
import io.nextrun.spi.CronSchedule;
import io.nextrun.spi.DaysSchedule;
import io.nextrun.spi.HoursSchedule;
import io.nextrun.spi.MinutesSchedule;
import io.nextrun.spi.MonthsSchedule;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleType;
import io.nextrun.spi.WeeksSchedule;

import static java.util.Locale.ENGLISH;

/**
 * Describes a schedule in words, e.g. "Every 2 hours at :30".
 */
public class ScheduleDescriptionFormatter
{
    static final String UNKNOWN_SCHEDULE = "Scheduled trigger";
    static final String MINUTES_WITHOUT_INTERVAL = "Every X minutes";
    static final String CRON_WITHOUT_EXPRESSION = "Custom cron schedule";

    private final ScheduleConfigurationManager configurationManager;

    @Inject
    public ScheduleDescriptionFormatter(ScheduleConfigurationManager configurationManager)
    {
        this.configurationManager = configurationManager;
    }

    public String describe(Config configuration)
    {
        Optional<String> type = configuration.getOptional("type", String.class);
        if (!type.isPresent() || type.get().isEmpty()) {
            return "";
        }

        Optional<ScheduleConfiguration> schedule = configurationManager.tryGetSchedule(configuration);
        if (schedule.isPresent()) {
            return describe(schedule.get());
        }
        else if (type.get().equals(ScheduleType.MINUTES.toString())) {
            return MINUTES_WITHOUT_INTERVAL;
        }
        return UNKNOWN_SCHEDULE;
    }

    public String describe(ScheduleConfiguration schedule)
    {
        return schedule.accept(new ScheduleConfiguration.Visitor<String>() {
            @Override
            public String visit(MinutesSchedule schedule)
            {
                return every(schedule.getMinutesInterval(), "minute");
            }

            @Override
            public String visit(HoursSchedule schedule)
            {
                return every(schedule.getHoursInterval(), "hour") + " at :" + twoDigits(schedule.getMinute());
            }

            @Override
            public String visit(DaysSchedule schedule)
            {
                return every(schedule.getDaysInterval(), "day") + " at " + time(schedule.getHour(), schedule.getMinute());
            }

            @Override
            public String visit(WeeksSchedule schedule)
            {
                StringBuilder sb = new StringBuilder(every(schedule.getWeeksInterval(), "week"));
                if (!schedule.getWeekDays().isEmpty()) {
                    sb.append(" on ").append(weekDays(schedule.getWeekDays()));
                }
                sb.append(" at ").append(time(schedule.getHour(), schedule.getMinute()));
                return sb.toString();
            }

            @Override
            public String visit(MonthsSchedule schedule)
            {
                return every(schedule.getMonthsInterval(), "month")
                    + " on day " + schedule.getDayOfMonth()
                    + " at " + time(schedule.getHour(), schedule.getMinute());
            }

            @Override
            public String visit(CronSchedule schedule)
            {
                if (schedule.getCronExpression().trim().isEmpty()) {
                    return CRON_WITHOUT_EXPRESSION;
                }
                return "Cron: " + schedule.getCronExpression();
            }
        });
    }

    private static String every(int interval, String unit)
    {
        return "Every " + interval + " " + unit + (interval == 1 ? "" : "s");
    }

    private static String time(int hour, int minute)
    {
        return twoDigits(hour) + ":" + twoDigits(minute);
    }

    private static String twoDigits(int value)
    {
        return String.format(ENGLISH, "%02d", value);
    }

    private static String weekDays(List<DayOfWeek> days)
    {
        return Joiner.on(", ").join(Lists.transform(days, day -> day.getDisplayName(TextStyle.FULL, ENGLISH)));
    }
}
