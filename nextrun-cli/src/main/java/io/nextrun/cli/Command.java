package io.nextrun.cli;

import com.beust.jcommander.Parameter;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import io.nextrun.client.NodeMapper;
import io.nextrun.client.api.RestTriggerNode;
import io.nextrun.client.config.ConfigException;
import io.nextrun.core.schedule.PreviewModule;
import io.nextrun.standards.schedule.ScheduleModule;
import io.nextrun.standards.schedule.cron.CronDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static io.nextrun.cli.SystemExitException.systemExit;

public abstract class Command
{
    private static final Logger log = LoggerFactory.getLogger(Command.class);

    static final String CRON_DIALECT_KEY = "cron.dialect";
    static final String DISPLAY_ZONE_KEY = "display.zone";

    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "warn";

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException, SystemExitException
    {
        // Property order of precedence:
        // 1. Explicit configuration file (if --config was specified)
        // 2. JVM System properties (-D...)
        Properties props = new Properties();
        props.putAll(System.getProperties());

        if (configPath != null) {
            Path path = Paths.get(configPath);
            try (InputStream in = Files.newInputStream(path)) {
                props.load(in);
            }
            catch (NoSuchFileException ex) {
                log.debug("configuration file not found: {}", path, ex);
                throw systemExit("Configuration file not found: " + configPath);
            }
        }

        return props;
    }

    protected Injector newInjector(Properties props, String cronDialectOption, String displayZoneOption, Clock clock)
        throws SystemExitException
    {
        String dialectName = cronDialectOption != null ? cronDialectOption : props.getProperty(CRON_DIALECT_KEY, CronDialect.UNIX.toString());
        String zoneName = displayZoneOption != null ? displayZoneOption : props.getProperty(DISPLAY_ZONE_KEY);

        CronDialect dialect;
        try {
            dialect = CronDialect.fromString(dialectName);
        }
        catch (IllegalArgumentException ex) {
            throw systemExit(ex.getMessage());
        }

        ZoneId displayZone;
        try {
            displayZone = zoneName != null ? ZoneId.of(zoneName) : ZoneId.systemDefault();
        }
        catch (DateTimeException ex) {
            throw systemExit("Unknown time zone name: " + zoneName);
        }

        log.debug("Using cron dialect {} and display zone {}", dialect, displayZone);
        return Guice.createInjector(
                new ScheduleModule(dialect),
                new PreviewModule(displayZone, clock));
    }

    protected RestTriggerNode loadNode(String path)
        throws IOException, SystemExitException
    {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return NodeMapper.readTriggerNode(NodeMapper.objectMapper(), in);
        }
        catch (NoSuchFileException ex) {
            throw systemExit("File not found: " + path);
        }
        catch (ConfigException ex) {
            throw systemExit(ex.getMessage());
        }
    }
}
