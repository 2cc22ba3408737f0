package io.nextrun.cli;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

import static io.nextrun.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class TimeUtil
{
    private static final DateTimeFormatter INSTANT_PARSER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", ENGLISH);

    // accepts unix time in seconds, ISO-8601 with offset or "yyyy-MM-dd HH:mm:ss Z"
    public static Instant parseTime(String s, String errorMessage)
            throws SystemExitException
    {
        try {
            return Instant.ofEpochSecond(Long.parseLong(s));
        }
        catch (NumberFormatException notUnixTime) {
            try {
                return Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(s));
            }
            catch (DateTimeException notIsoTime) {
                try {
                    return Instant.from(INSTANT_PARSER.parse(s));
                }
                catch (DateTimeException ex) {
                    throw systemExit(errorMessage + ": " + s);
                }
            }
        }
    }
}
