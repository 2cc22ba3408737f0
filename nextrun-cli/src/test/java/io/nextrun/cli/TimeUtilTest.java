package io.nextrun.cli;

import java.time.Instant;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class TimeUtilTest
{
    @Test
    public void parseTime()
            throws Exception
    {
        Instant expected = Instant.parse("2024-01-01T10:15:00Z");

        assertThat(TimeUtil.parseTime("1704104100", "invalid"), is(expected));
        assertThat(TimeUtil.parseTime("2024-01-01T10:15:00Z", "invalid"), is(expected));
        assertThat(TimeUtil.parseTime("2024-01-01T19:15:00+09:00", "invalid"), is(expected));
        assertThat(TimeUtil.parseTime("2024-01-01 10:15:00 +0000", "invalid"), is(expected));
    }

    @Test
    public void invalidTime()
    {
        try {
            TimeUtil.parseTime("2024-01-01", "--now must be a time");
            fail();
        }
        catch (SystemExitException ex) {
            assertThat(ex.getCode(), is(1));
            assertThat(ex.getMessage(), is("--now must be a time: 2024-01-01"));
        }
    }
}
