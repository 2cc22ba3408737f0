package io.nextrun.standards.schedule.cron;

import java.time.Instant;

import com.cronutils.model.CronType;
import com.google.common.base.Optional;
import io.nextrun.spi.CronEvaluator;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class CronEvaluatorTest
{
    private static Optional<Instant> at(String time)
    {
        return Optional.of(Instant.parse(time));
    }

    @Test
    public void unix()
    {
        CronEvaluator evaluator = new CronUtilsEvaluator(CronType.UNIX);

        assertThat(evaluator.evaluate("0 9 * * *", Instant.parse("2024-01-01T10:00:00Z")), is(at("2024-01-02T09:00:00Z")));
        assertThat(evaluator.evaluate("0 9 * * *", Instant.parse("2024-01-01T08:59:59Z")), is(at("2024-01-01T09:00:00Z")));
        assertThat(evaluator.evaluate("*/15 * * * *", Instant.parse("2024-01-01T10:07:42Z")), is(at("2024-01-01T10:15:00Z")));
        // 2024-01-05 is a Friday
        assertThat(evaluator.evaluate("30 18 * * 1-5", Instant.parse("2024-01-05T19:00:00Z")), is(at("2024-01-08T18:30:00Z")));
    }

    @Test
    public void quartz()
    {
        CronEvaluator evaluator = new CronUtilsEvaluator(CronType.QUARTZ);

        assertThat(evaluator.evaluate("0 0 9 * * ?", Instant.parse("2024-01-01T10:00:00Z")), is(at("2024-01-02T09:00:00Z")));
        assertThat(evaluator.evaluate("30 * * * * ?", Instant.parse("2024-01-01T10:00:00Z")), is(at("2024-01-01T10:00:30Z")));
    }

    @Test
    public void cron4j()
    {
        CronEvaluator evaluator = new Cron4jEvaluator();

        assertThat(evaluator.evaluate("0 9 * * *", Instant.parse("2024-01-01T10:00:00Z")), is(at("2024-01-02T09:00:00Z")));
        assertThat(evaluator.evaluate("0 9 * * *", Instant.parse("2024-01-01T08:30:00Z")), is(at("2024-01-01T09:00:00Z")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedUnixExpression()
    {
        new CronUtilsEvaluator(CronType.UNIX).evaluate("every day", Instant.parse("2024-01-01T10:00:00Z"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedCron4jPattern()
    {
        new Cron4jEvaluator().evaluate("61 * * * *", Instant.parse("2024-01-01T10:00:00Z"));
    }

    @Test(timeout = 10000)
    public void cron4jPatternMatchingNoDayIsAbsent()
    {
        CronEvaluator evaluator = new Cron4jEvaluator();

        assertThat(evaluator.evaluate("0 0 30 2 *", Instant.parse("2024-01-01T10:00:00Z")), is(Optional.absent()));
        assertThat(evaluator.evaluate("0 0 31 4,6,9,11 *", Instant.parse("2024-01-01T10:00:00Z")), is(Optional.absent()));
    }

    @Test(timeout = 10000)
    public void cron4jLeapDay()
    {
        CronEvaluator evaluator = new Cron4jEvaluator();

        assertThat(evaluator.evaluate("0 0 29 2 *", Instant.parse("2024-03-01T00:00:00Z")), is(at("2028-02-29T00:00:00Z")));
    }

    @Test(timeout = 10000)
    public void cron4jAnySubPatternMatching()
    {
        CronEvaluator evaluator = new Cron4jEvaluator();

        assertThat(evaluator.evaluate("0 0 30 2 *|0 12 * * *", Instant.parse("2024-01-01T10:00:00Z")), is(at("2024-01-01T12:00:00Z")));
    }

    @Test
    public void checkUnixExpression()
    {
        CronEvaluator evaluator = new CronUtilsEvaluator(CronType.UNIX);

        assertThat(evaluator.check("0 9 * * *"), is(Optional.absent()));
        assertThat(evaluator.check("every day").get(), containsString("Invalid unix cron expression: every day"));
    }

    @Test
    public void checkQuartzExpression()
    {
        CronEvaluator evaluator = new CronUtilsEvaluator(CronType.QUARTZ);

        assertThat(evaluator.check("0 0 9 * * ?"), is(Optional.absent()));
        assertThat(evaluator.check("0 9 * * *").get(), containsString("Invalid quartz cron expression: 0 9 * * *"));
    }

    @Test
    public void checkCron4jPattern()
    {
        CronEvaluator evaluator = new Cron4jEvaluator();

        assertThat(evaluator.check("0 9 * * *"), is(Optional.absent()));
        // well-formed even though it never matches
        assertThat(evaluator.check("0 0 30 2 *"), is(Optional.absent()));
        assertThat(evaluator.check("61 * * * *").get(), containsString("Invalid cron4j pattern: 61 * * * *"));
    }
}
