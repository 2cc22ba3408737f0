package io.nextrun.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestTriggerMetadata.class)
public interface RestTriggerMetadata
{
    /**
     * Next trigger time computed by the backend scheduler.
     *
     * Kept as the raw string because a value that fails to parse must not
     * reject the whole node; it is ignored by the resolver instead.
     */
    Optional<String> getNextTrigger();

    static ImmutableRestTriggerMetadata.Builder builder()
    {
        return ImmutableRestTriggerMetadata.builder();
    }
}
