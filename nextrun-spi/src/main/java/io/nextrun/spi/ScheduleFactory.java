package io.nextrun.spi;

import io.nextrun.client.config.Config;

public interface ScheduleFactory
{
    ScheduleType getType();

    /**
     * Builds a typed schedule from the configuration of a trigger node.
     *
     * @throws io.nextrun.client.config.ConfigException if a parameter has an unexpected type
     */
    ScheduleConfiguration newSchedule(Config config, double timezone);
}
