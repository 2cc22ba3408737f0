package io.nextrun.core.schedule;

import java.util.Map;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.nextrun.client.config.Config;
import io.nextrun.client.config.ConfigException;
import io.nextrun.spi.ScheduleConfiguration;
import io.nextrun.spi.ScheduleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw configuration of a trigger node into a typed schedule using
 * the registered {@link ScheduleFactory}s.
 */
public class ScheduleConfigurationManager
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleConfigurationManager.class);

    private final Map<String, ScheduleFactory> types;

    @Inject
    public ScheduleConfigurationManager(Set<ScheduleFactory> factories)
    {
        ImmutableMap.Builder<String, ScheduleFactory> builder = ImmutableMap.builder();
        for (ScheduleFactory factory : factories) {
            builder.put(factory.getType().toString(), factory);
        }
        this.types = builder.build();
    }

    public Optional<ScheduleConfiguration> tryGetSchedule(Config config)
    {
        try {
            return Optional.of(getSchedule(config));
        }
        catch (ConfigException ex) {
            logger.debug("Schedule configuration is not usable: {}", ex.getMessage());
            return Optional.absent();
        }
    }

    public ScheduleConfiguration getSchedule(Config config)
    {
        Optional<String> type = config.getOptional("type", String.class);
        if (!type.isPresent()) {
            throw new ConfigException("Schedule configuration requires 'type' parameter: " + config);
        }

        ScheduleFactory factory = types.get(type.get());
        if (factory == null) {
            throw new ConfigException("Unknown schedule type: " + type.get());
        }

        return factory.newSchedule(config, getTimezone(config));
    }

    // timezone is a number or a numeric string; missing or empty means UTC
    static double getTimezone(Config config)
    {
        Optional<String> timezone = config.getOptional("timezone", String.class);
        if (!timezone.isPresent() || timezone.get().trim().isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(timezone.get().trim());
        }
        catch (NumberFormatException ex) {
            throw new ConfigException("Parameter 'timezone' must be a number of hours but got: " + timezone.get(), ex);
        }
    }
}
