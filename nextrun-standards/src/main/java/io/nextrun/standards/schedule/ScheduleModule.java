package io.nextrun.standards.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.TypeLiteral;
import com.google.inject.multibindings.Multibinder;
import io.nextrun.spi.CronEvaluator;
import io.nextrun.spi.CronSchedule;
import io.nextrun.spi.DaysSchedule;
import io.nextrun.spi.HoursSchedule;
import io.nextrun.spi.MinutesSchedule;
import io.nextrun.spi.MonthsSchedule;
import io.nextrun.spi.NextTriggerCalculator;
import io.nextrun.spi.ScheduleFactory;
import io.nextrun.spi.WeeksSchedule;
import io.nextrun.standards.schedule.cron.CronDialect;

public class ScheduleModule
    implements Module
{
    private final CronDialect cronDialect;

    public ScheduleModule()
    {
        this(CronDialect.UNIX);
    }

    public ScheduleModule(CronDialect cronDialect)
    {
        this.cronDialect = cronDialect;
    }

    @Override
    public void configure(Binder binder)
    {
        addStandardScheduleFactory(binder, MinutesScheduleFactory.class);
        addStandardScheduleFactory(binder, HoursScheduleFactory.class);
        addStandardScheduleFactory(binder, DaysScheduleFactory.class);
        addStandardScheduleFactory(binder, WeeksScheduleFactory.class);
        addStandardScheduleFactory(binder, MonthsScheduleFactory.class);
        addStandardScheduleFactory(binder, CronScheduleFactory.class);
        binder.bind(ScheduleConfigHelper.class).in(Scopes.SINGLETON);

        binder.bind(new TypeLiteral<NextTriggerCalculator<MinutesSchedule>>() {})
            .to(MinutesNextTriggerCalculator.class).in(Scopes.SINGLETON);
        binder.bind(new TypeLiteral<NextTriggerCalculator<HoursSchedule>>() {})
            .to(HoursNextTriggerCalculator.class).in(Scopes.SINGLETON);
        binder.bind(new TypeLiteral<NextTriggerCalculator<DaysSchedule>>() {})
            .to(DaysNextTriggerCalculator.class).in(Scopes.SINGLETON);
        binder.bind(new TypeLiteral<NextTriggerCalculator<WeeksSchedule>>() {})
            .to(WeeksNextTriggerCalculator.class).in(Scopes.SINGLETON);
        binder.bind(new TypeLiteral<NextTriggerCalculator<MonthsSchedule>>() {})
            .to(MonthsNextTriggerCalculator.class).in(Scopes.SINGLETON);
        binder.bind(new TypeLiteral<NextTriggerCalculator<CronSchedule>>() {})
            .to(CronNextTriggerCalculator.class).in(Scopes.SINGLETON);

        binder.bind(CronEvaluator.class).toInstance(cronDialect.newEvaluator());
    }

    protected void addStandardScheduleFactory(Binder binder, Class<? extends ScheduleFactory> factory)
    {
        Multibinder.newSetBinder(binder, ScheduleFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
