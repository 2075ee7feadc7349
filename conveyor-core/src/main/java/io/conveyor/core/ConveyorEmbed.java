package io.conveyor.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Modules;
import io.conveyor.core.database.DatabaseModule;
import io.conveyor.core.database.TransactionManager;
import io.conveyor.core.execution.ExecutionModule;
import io.conveyor.core.notification.NotificationModule;
import io.conveyor.core.reconcile.ManifestReconciler;
import io.conveyor.core.reconcile.ReconcileModule;
import io.conveyor.core.schedule.ScheduleModule;
import io.conveyor.core.schedule.ScheduledJobService;
import io.conveyor.core.schedule.SchedulingEngine;
import io.conveyor.spi.config.Config;
import io.conveyor.spi.config.ConfigElement;
import io.conveyor.spi.config.ConfigFactory;
import org.embulk.guice.LifeCycleInjector;

/**
 * Builds the scheduler with its storage, execution and notification components.
 *
 * The embedding application binds {@link io.conveyor.spi.PipelineResolver},
 * {@link io.conveyor.spi.PipelineExecutionService} and {@link io.conveyor.spi.DaemonRestartService}
 * through {@link Bootstrap#addModules(Module...)}.
 */
public class ConveyorEmbed
        implements AutoCloseable
{
    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();
        private boolean withSchedulerStarter = true;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        // false leaves the engine stopped until start() is called on it
        public Bootstrap withSchedulerStarter(boolean v)
        {
            this.withSchedulerStarter = v;
            return this;
        }

        public ConveyorEmbed initialize()
        {
            return build(true);
        }

        public ConveyorEmbed initializeWithoutShutdownHook()
        {
            return build(false);
        }

        private ConveyorEmbed build(boolean destroyOnShutdownHook)
        {
            org.embulk.guice.Bootstrap bootstrap = build();

            LifeCycleInjector injector;
            if (destroyOnShutdownHook) {
                injector = bootstrap.initialize();
            }
            else {
                injector = bootstrap.initializeCloseable();
            }

            return new ConveyorEmbed(injector);
        }

        public org.embulk.guice.Bootstrap build()
        {
            org.embulk.guice.Bootstrap bootstrap = new org.embulk.guice.Bootstrap()
                .requireExplicitBindings(true)
                .addModules(standardModules(systemConfig));
            moduleOverrides.stream().forEach(override -> bootstrap.overrideModules(override));
            return bootstrap;
        }

        private List<Module> standardModules(ConfigElement systemConfig)
        {
            ImmutableList.Builder<Module> builder = ImmutableList.builder();
            builder.addAll(Arrays.asList(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JavaTimeModule()),
                    new DatabaseModule(),
                    new ScheduleModule(),
                    new ExecutionModule(),
                    new NotificationModule(),
                    new ReconcileModule(),
                    (binder) -> {
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
                    }
                ));
            if (withSchedulerStarter) {
                builder.add((binder) -> {
                    binder.bind(SchedulerStarter.class).asEagerSingleton();
                });
            }
            return builder.build();
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final LifeCycleInjector injector;

    ConveyorEmbed(LifeCycleInjector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public SchedulingEngine getSchedulingEngine()
    {
        return getInjector().getInstance(SchedulingEngine.class);
    }

    public ScheduledJobService getScheduledJobService()
    {
        return getInjector().getInstance(ScheduledJobService.class);
    }

    public ManifestReconciler getManifestReconciler()
    {
        return getInjector().getInstance(ManifestReconciler.class);
    }

    public TransactionManager getTransactionManager()
    {
        return getInjector().getInstance(TransactionManager.class);
    }

    @Override
    public void close() throws Exception
    {
        injector.destroy();
    }
}
