package io.nextrun.standards.schedule.cron;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import io.nextrun.spi.CronEvaluator;
import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.Predictor;
import it.sauronsoftware.cron4j.SchedulingPattern;

/**
 * Evaluates cron4j scheduling patterns.
 *
 * {@link Predictor} never returns for a pattern whose date fields can't
 * match any day (e.g. February 30), so patterns are first checked to match
 * some day within {@link #HORIZON_DAYS} of the reference.
 */
public class Cron4jEvaluator
        implements CronEvaluator
{
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    // two leap years at least
    static final int HORIZON_DAYS = 366 * 8;

    private static final long MILLIS_PER_DAY = 24 * 60 * 60 * 1000L;

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
        SchedulingPattern pattern = parse(cronExpression);

        if (!matchesAnyDay(cronExpression, reference, HORIZON_DAYS)) {
            return Optional.absent();
        }

        // Predictor returns the first matching time after the start, excluding the start itself
        Predictor predictor = new Predictor(pattern, Date.from(reference));
        predictor.setTimeZone(UTC);
        return Optional.of(Instant.ofEpochMilli(predictor.nextMatchingTime()));
    }

    private static SchedulingPattern parse(String cronExpression)
    {
        try {
            return new SchedulingPattern(cronExpression) {
                // workaround for a bug of cron4j:
                // https://gist.github.com/frsyuki/618c4e6c1f5f876e4ee74b9da2fd37c0
                @Override
                public boolean match(long millis)
                {
                    return match(UTC, millis);
                }
            };
        }
        catch (InvalidPatternException ex) {
            throw new IllegalArgumentException("Invalid cron4j pattern: " + cronExpression + " (" + ex.getMessage() + ")", ex);
        }
    }

    // Minute and hour fields can always match, so only the date fields
    // (day of month, month, day of week) of each sub-pattern are scanned day by day.
    static boolean matchesAnyDay(String cronExpression, Instant reference, int days)
    {
        long firstDay = reference.truncatedTo(ChronoUnit.DAYS).toEpochMilli();
        for (String part : Splitter.on('|').trimResults().omitEmptyStrings().split(cronExpression)) {
            List<String> fields = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().splitToList(part);
            if (fields.size() < 3) {
                continue;
            }
            SchedulingPattern dates = new SchedulingPattern("* * " + Joiner.on(' ').join(fields.subList(2, fields.size())));
            for (int i = 0; i <= days; i++) {
                if (dates.match(UTC, firstDay + i * MILLIS_PER_DAY)) {
                    return true;
                }
            }
        }
        return false;
    }
}
