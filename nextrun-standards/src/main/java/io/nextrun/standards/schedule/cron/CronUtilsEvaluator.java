package io.nextrun.standards.schedule.cron;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.google.common.base.Optional;
import io.nextrun.spi.CronEvaluator;

/**
 * Evaluates UNIX or Quartz cron expressions with cron-utils.
 */
public class CronUtilsEvaluator
        implements CronEvaluator
{
    private final CronType cronType;
    private final CronParser parser;

    public CronUtilsEvaluator(CronType cronType)
    {
        this.cronType = cronType;
        this.parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(cronType));
    }

    @Override
    public Optional<String> check(String cronExpression)
    {
        try {
            parse(cronExpression);
            return Optional.absent();
        }
        catch (IllegalArgumentException ex) {
            return Optional.of(ex.getMessage());
        }
    }

    @Override
    public Optional<Instant> evaluate(String cronExpression, Instant reference)
    {
        Cron cron = parse(cronExpression);
        java.util.Optional<ZonedDateTime> next = ExecutionTime.forCron(cron)
            .nextExecution(ZonedDateTime.ofInstant(reference, ZoneOffset.UTC));
        return Optional.fromJavaUtil(next).transform(ZonedDateTime::toInstant);
    }

    private Cron parse(String cronExpression)
    {
        try {
            return parser.parse(cronExpression);
        }
        catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "Invalid " + cronType.name().toLowerCase(Locale.ENGLISH) + " cron expression: " + cronExpression + " (" + ex.getMessage() + ")", ex);
        }
    }
}
