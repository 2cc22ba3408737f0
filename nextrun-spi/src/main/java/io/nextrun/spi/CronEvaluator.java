package io.nextrun.spi;

import java.time.Instant;

import com.google.common.base.Optional;

/**
 * Evaluates cron expressions.
 */
public interface CronEvaluator
{
    /**
     * Returns the reason the expression can't be parsed, or absent if it is
     * well-formed.
     */
    Optional<String> check(String cronExpression);

    /**
     * Returns the first time after {@code reference} matching the expression,
     * evaluated on the UTC wall clock.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    Optional<Instant> evaluate(String cronExpression, Instant reference);
}
