package io.nextrun.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Optional;
import com.google.inject.Guice;
import io.nextrun.client.NodeMapper;
import io.nextrun.client.api.ImmutableRestTriggerNode;
import io.nextrun.client.api.RestTriggerMetadata;
import io.nextrun.client.api.RestTriggerNode;
import io.nextrun.standards.schedule.ScheduleModule;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TriggerPreviewServiceTest
{
    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private final TriggerPreviewService service = Guice.createInjector(
                new ScheduleModule(),
                new PreviewModule(ZoneOffset.UTC, Clock.fixed(NOW, ZoneOffset.UTC)))
            .getInstance(TriggerPreviewService.class);

    static ImmutableRestTriggerNode.Builder node(String configuration)
    {
        return RestTriggerNode.builder()
            .configuration(NodeMapper.configFactory().fromJsonString(configuration));
    }

    @Test
    public void localEstimate()
    {
        TriggerPreview preview = service.preview(node("{\"type\": \"minutes\", \"minutesInterval\": 5}").name("sync").build());

        assertThat(preview.getName(), is(Optional.of("sync")));
        assertThat(preview.getDescription(), is("Every 5 minutes"));
        assertThat(preview.getNextTrigger(), is(Optional.of(Instant.parse("2024-01-01T10:05:00Z"))));
        assertThat(preview.getHint(), is("Next: in 5m"));
    }

    @Test
    public void backendNextTrigger()
    {
        RestTriggerNode node = node("{\"type\": \"minutes\", \"minutesInterval\": 5}")
            .metadata(RestTriggerMetadata.builder().nextTrigger("2024-01-01T13:00:00Z").build())
            .build();
        TriggerPreview preview = service.preview(node, NOW);

        assertThat(preview.getNextTrigger(), is(Optional.of(Instant.parse("2024-01-01T13:00:00Z"))));
        assertThat(preview.getHint(), is("Next: in 3h"));
    }

    @Test
    public void metadataWithoutNextTrigger()
    {
        RestTriggerNode node = node("{\"type\": \"days\", \"hour\": 9}")
            .metadata(RestTriggerMetadata.builder().build())
            .build();
        TriggerPreview preview = service.preview(node, NOW);

        assertThat(preview.getNextTrigger(), is(Optional.of(Instant.parse("2024-01-02T09:00:00Z"))));
        assertThat(preview.getHint(), is("Next: in 23h"));
    }

    @Test
    public void noSchedule()
    {
        TriggerPreview preview = service.preview(node("{}").build(), NOW);

        assertThat(preview.getName(), is(Optional.absent()));
        assertThat(preview.getDescription(), is(""));
        assertThat(preview.getNextTrigger(), is(Optional.absent()));
        assertThat(preview.getHint(), is("-"));
    }

    @Test
    public void serializedAsJson()
    {
        TriggerPreview preview = service.preview(node("{\"type\": \"hours\", \"minute\": 30}").name("hourly").build(), NOW);

        JsonNode json = NodeMapper.objectMapper().valueToTree(preview);
        assertThat(json.get("name").asText(), is("hourly"));
        assertThat(json.get("description").asText(), is("Every 1 hour at :30"));
        assertThat(json.get("nextTrigger").asText(), is("2024-01-01T11:30:00Z"));
        assertThat(json.get("hint").asText(), is("Next: in 1h"));
    }
}
