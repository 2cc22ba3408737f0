package io.nextrun.cli;

import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Injector;
import io.nextrun.client.NodeMapper;
import io.nextrun.client.api.RestTriggerMetadata;
import io.nextrun.client.api.RestTriggerNode;
import io.nextrun.core.schedule.RelativeTimeFormatter;
import io.nextrun.core.schedule.TriggerPreview;
import io.nextrun.core.schedule.TriggerPreviewService;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static io.nextrun.cli.SystemExitException.systemExit;

public class Preview
    extends Command
{
    @Parameter(names = {"--now"})
    String nowString = null;

    @Parameter(names = {"--next-trigger"})
    String nextTrigger = null;

    @Parameter(names = {"--cron-dialect"})
    String cronDialect = null;

    @Parameter(names = {"--display-zone"})
    String displayZone = null;

    @Parameter(names = {"-o", "--output"})
    String output = "text";

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        if (!output.equals("text") && !output.equals("json")) {
            throw usage("Unknown output format '" + output + "'");
        }

        Instant now = nowString != null
            ? TimeUtil.parseTime(nowString, "--now must be an ISO-8601 time or unix time")
            : Instant.now();

        RestTriggerNode node = loadNode(args.get(0));
        if (nextTrigger != null) {
            node = RestTriggerNode.builder()
                .from(node)
                .metadata(RestTriggerMetadata.builder().nextTrigger(nextTrigger).build())
                .build();
        }

        Injector injector = newInjector(loadSystemProperties(), cronDialect, displayZone, Clock.fixed(now, ZoneOffset.UTC));
        TriggerPreview preview = injector.getInstance(TriggerPreviewService.class).preview(node, now);

        if (output.equals("json")) {
            ObjectMapper mapper = NodeMapper.objectMapper();
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(preview));
        }
        else {
            out.println("  name: " + preview.getName().or(""));
            out.println("  schedule: " + preview.getDescription());
            out.println("  next trigger: " + preview.getNextTrigger().transform(Instant::toString).or(RelativeTimeFormatter.NO_NEXT_TRIGGER));
            out.println("  hint: " + preview.getHint());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " preview <node.json> [options...]");
        err.println("  Options:");
        err.println("        --now TIME                   calculate as of this time (default: current time)");
        err.println("        --next-trigger TIME          next trigger time computed by the backend");
        err.println("        --cron-dialect DIALECT       unix, quartz or cron4j (default: unix)");
        err.println("        --display-zone ZONE          time zone to show absolute times in (default: system)");
        err.println("    -o, --output FORMAT              text or json (default: text)");
        Main.showCommonOptions(err);
        return systemExit(error);
    }
}
