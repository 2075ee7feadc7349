package io.conveyor.core.notification;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.conveyor.core.schedule.SchedulingListener;
import io.conveyor.spi.SchedulerFailureNotifier;

public class NotificationModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(SchedulerFailureNotifier.class).to(DefaultSchedulerFailureNotifier.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, SchedulingListener.class)
            .addBinding().to(FailureNotificationListener.class).in(Scopes.SINGLETON);
    }
}
