package io.nextrun.core.schedule;

import java.time.Clock;
import java.time.ZoneId;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class PreviewModule
    implements Module
{
    private final ZoneId displayZone;
    private final Clock clock;

    public PreviewModule()
    {
        this(ZoneId.systemDefault(), Clock.systemUTC());
    }

    public PreviewModule(ZoneId displayZone, Clock clock)
    {
        this.displayZone = displayZone;
        this.clock = clock;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(Clock.class).toInstance(clock);
        binder.bind(RelativeTimeFormatter.class).toInstance(new RelativeTimeFormatter(displayZone));
        binder.bind(ScheduleConfigurationManager.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleDescriptionFormatter.class).in(Scopes.SINGLETON);
        binder.bind(NextTriggerResolver.class).in(Scopes.SINGLETON);
        binder.bind(TriggerPreviewService.class).in(Scopes.SINGLETON);
    }
}
