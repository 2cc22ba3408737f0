package io.nextrun.core.schedule;

import java.time.Clock;
import java.time.Instant;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.client.api.RestTriggerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TriggerPreviewService
{
    private static final Logger logger = LoggerFactory.getLogger(TriggerPreviewService.class);

    private final NextTriggerResolver resolver;
    private final ScheduleDescriptionFormatter descriptionFormatter;
    private final RelativeTimeFormatter timeFormatter;
    private final Clock clock;

    @Inject
    public TriggerPreviewService(
            NextTriggerResolver resolver,
            ScheduleDescriptionFormatter descriptionFormatter,
            RelativeTimeFormatter timeFormatter,
            Clock clock)
    {
        this.resolver = resolver;
        this.descriptionFormatter = descriptionFormatter;
        this.timeFormatter = timeFormatter;
        this.clock = clock;
    }

    public TriggerPreview preview(RestTriggerNode node)
    {
        return preview(node, clock.instant());
    }

    public TriggerPreview preview(RestTriggerNode node, Instant now)
    {
        Optional<String> authoritative = node.getMetadata().isPresent()
            ? node.getMetadata().get().getNextTrigger()
            : Optional.<String>absent();

        Optional<Instant> next = resolver.computeNext(node.getConfiguration(), authoritative, now);
        logger.debug("Next trigger of node {}: {}", node.getName().or("(unnamed)"), next);

        return TriggerPreview.builder()
            .name(node.getName())
            .description(descriptionFormatter.describe(node.getConfiguration()))
            .nextTrigger(next)
            .hint(timeFormatter.format(next, now))
            .build();
    }
}
