package io.conveyor.core.schedule;

import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;

import io.conveyor.spi.TriggerFactory;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleConfig.class).toProvider(ScheduleConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(TriggerManager.class).in(Scopes.SINGLETON);
        binder.bind(StartupGraceGuard.class).in(Scopes.SINGLETON);
        binder.bind(SchedulingEngine.class).in(Scopes.SINGLETON);
        binder.bind(ScheduledJobService.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, TriggerFactory.class);
        Multibinder.newSetBinder(binder, SchedulingListener.class);
    }
}
