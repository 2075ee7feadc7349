package io.conveyor.standards.trigger;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.conveyor.spi.TriggerFactory;

public class TriggerModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardTriggerFactory(binder, CronTriggerFactory.class);
        addStandardTriggerFactory(binder, IntervalTriggerFactory.class);
        addStandardTriggerFactory(binder, DateTriggerFactory.class);
    }

    protected void addStandardTriggerFactory(Binder binder, Class<? extends TriggerFactory> factory)
    {
        Multibinder.newSetBinder(binder, TriggerFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
