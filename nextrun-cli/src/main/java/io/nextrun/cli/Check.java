package io.nextrun.cli;

import com.google.common.base.Optional;
import com.google.inject.Injector;
import io.nextrun.client.api.RestTriggerNode;
import io.nextrun.client.config.ConfigException;
import io.nextrun.core.schedule.NextTriggerResolver;
import io.nextrun.core.schedule.ScheduleConfigurationManager;
import io.nextrun.core.schedule.ScheduleDescriptionFormatter;
import io.nextrun.spi.ScheduleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

import static io.nextrun.cli.SystemExitException.systemExit;

public class Check
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Check.class);

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }

        RestTriggerNode node = loadNode(args.get(0));
        Injector injector = newInjector(loadSystemProperties(), null, null, Clock.systemUTC());

        ScheduleConfiguration schedule;
        try {
            schedule = injector.getInstance(ScheduleConfigurationManager.class).getSchedule(node.getConfiguration());
        }
        catch (ConfigException ex) {
            logger.debug("Invalid schedule configuration: {}", node.getConfiguration(), ex);
            throw systemExit(ex.getMessage());
        }

        Optional<String> invalid = injector.getInstance(NextTriggerResolver.class).checkSchedule(schedule);
        if (invalid.isPresent()) {
            throw systemExit(invalid.get());
        }

        out.println("ok: " + injector.getInstance(ScheduleDescriptionFormatter.class).describe(schedule));
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " check <node.json> [options...]");
        Main.showCommonOptions(err);
        return systemExit(error);
    }
}
