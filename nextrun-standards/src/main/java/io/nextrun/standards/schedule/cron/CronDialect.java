package io.nextrun.standards.schedule.cron;

import com.cronutils.model.CronType;
import io.nextrun.spi.CronEvaluator;

import static java.util.Locale.ENGLISH;

public enum CronDialect
{
    UNIX("unix"),
    QUARTZ("quartz"),
    CRON4J("cron4j");

    private final String name;

    private CronDialect(String name)
    {
        this.name = name;
    }

    public static CronDialect fromString(String name)
    {
        switch (name.trim().toLowerCase(ENGLISH)) {
        case "unix":
            return UNIX;
        case "quartz":
            return QUARTZ;
        case "cron4j":
            return CRON4J;
        default:
            throw new IllegalArgumentException("Unknown cron dialect: " + name);
        }
    }

    public CronEvaluator newEvaluator()
    {
        switch (this) {
        case QUARTZ:
            return new CronUtilsEvaluator(CronType.QUARTZ);
        case CRON4J:
            return new Cron4jEvaluator();
        case UNIX:
        default:
            return new CronUtilsEvaluator(CronType.UNIX);
        }
    }

    @Override
    public String toString()
    {
        return name;
    }
}
