package io.nextrun.core.schedule;

import java.time.Instant;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableTriggerPreview.class)
public interface TriggerPreview
{
    Optional<String> getName();

    /**
     * The schedule in words, empty if the node has no schedule type.
     */
    String getDescription();

    /**
     * The backend's next trigger time if known, otherwise the local estimate.
     */
    Optional<Instant> getNextTrigger();

    /**
     * Short hint such as "Next: in 5m".
     */
    String getHint();

    static ImmutableTriggerPreview.Builder builder()
    {
        return ImmutableTriggerPreview.builder();
    }
}
