package io.conveyor.core.execution;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * The long-lived executor of this process that owns submitted runs. Firing threads hand
 * work to it and wait for acceptance, so a run survives the wait timing out.
 */
public class PrimaryRuntime
{
    private static final Logger logger = LoggerFactory.getLogger(PrimaryRuntime.class);

    private final ExecutorService executor;
    private final int shutdownTimeout;

    @Inject
    public PrimaryRuntime(ExecutionConfig config)
    {
        this(config.getRuntimeThreads(), config.getRuntimeShutdownTimeout());
    }

    public PrimaryRuntime(int threads, int shutdownTimeoutSeconds)
    {
        this.shutdownTimeout = shutdownTimeoutSeconds;
        this.executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("primary-runtime-%d")
                .build()
                );
    }

    public <T> Future<T> submit(Callable<T> task)
    {
        return executor.submit(task);
    }

    public boolean isShutdown()
    {
        return executor.isShutdown();
    }

    @PreDestroy
    public void shutdown()
    {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout, TimeUnit.SECONDS)) {
                logger.warn("Submitted tasks did not finish within {} seconds. Interrupting them", shutdownTimeout);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
