package io.nextrun.spi;

import java.time.Instant;

import com.google.common.base.Optional;

public interface NextTriggerCalculator<S extends ScheduleConfiguration>
{
    // Returns the reason the schedule can't be calculated, or absent if it's valid.
    Optional<String> checkSchedule(S schedule);

    // nowInZone is the current time shifted by the schedule's timezone offset.
    // Calculation uses its UTC fields as the local wall clock, and the
    // returned instant is in the same shifted frame.
    // Returns absent if checkSchedule rejects the schedule.
    Optional<Instant> nextTrigger(S schedule, Instant nowInZone);
}
