package io.nextrun.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.nextrun.client.config.Config;
import org.immutables.value.Value;

/**
 * A schedule trigger node of a canvas as the backend serves it.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRestTriggerNode.class)
public interface RestTriggerNode
{
    Optional<String> getName();

    Config getConfiguration();

    Optional<RestTriggerMetadata> getMetadata();

    static ImmutableRestTriggerNode.Builder builder()
    {
        return ImmutableRestTriggerNode.builder();
    }
}
