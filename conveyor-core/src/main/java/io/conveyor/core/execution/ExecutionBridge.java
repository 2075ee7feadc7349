package io.conveyor.core.execution;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.conveyor.spi.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands submission tasks from firing threads to the {@link PrimaryRuntime} and waits,
 * bounded, for the execution backend to accept them.
 *
 * When no runtime is attached the task runs on the calling thread. A task that times
 * out is not cancelled.
 */
public class ExecutionBridge
{
    private static final Logger logger = LoggerFactory.getLogger(ExecutionBridge.class);

    @Inject(optional = true)
    private PrimaryRuntime runtime = null;

    @Inject
    public ExecutionBridge()
    { }

    @VisibleForTesting
    public ExecutionBridge(PrimaryRuntime runtime)
    {
        this.runtime = runtime;
    }

    public boolean hasRuntime()
    {
        return runtime != null && !runtime.isShutdown();
    }

    public SubmissionResult submit(String description, Callable<SubmissionResult> task, Duration timeout)
        throws ExecutionSubmissionFailedException
    {
        SubmissionResult result;
        if (hasRuntime()) {
            result = submitToRuntime(description, task, timeout);
        }
        else {
            logger.debug("No primary runtime is attached. Running {} on the calling thread", description);
            try {
                result = task.call();
            }
            catch (Exception ex) {
                throw new ExecutionSubmissionFailedException("Failed to submit " + description + ": " + ex, ex);
            }
        }

        if (result == null) {
            throw new ExecutionSubmissionFailedException("Submission of " + description + " returned no result");
        }
        if (!result.isAccepted()) {
            throw new ExecutionSubmissionFailedException("Submission of " + description + " was rejected: "
                    + result.getMessage().or("no reason given"));
        }
        return result;
    }

    private SubmissionResult submitToRuntime(String description, Callable<SubmissionResult> task, Duration timeout)
        throws ExecutionSubmissionFailedException
    {
        Future<SubmissionResult> future;
        try {
            future = runtime.submit(task);
        }
        catch (RejectedExecutionException ex) {
            throw new ExecutionSubmissionFailedException("Primary runtime rejected " + description, ex);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException ex) {
            // the runtime owns the task, it may still be accepted later
            throw new ExecutionSubmissionFailedException(
                    "Submission of " + description + " was not accepted within " + timeout.getSeconds() + " seconds", ex);
        }
        catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new ExecutionSubmissionFailedException("Failed to submit " + description + ": " + cause, cause);
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExecutionSubmissionFailedException("Interrupted while waiting for submission of " + description, ex);
        }
    }
}
