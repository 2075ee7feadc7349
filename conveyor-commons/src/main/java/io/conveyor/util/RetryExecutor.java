package io.conveyor.util;

import java.util.function.Predicate;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * Runs an operation and retries it with exponential back-off while a predicate accepts the failure.
 *
 * Instances are immutable. Each {@code with*} / {@code on*} method returns a copy.
 */
public class RetryExecutor
{
    public static RetryExecutor retryExecutor()
    {
        return new RetryExecutor();
    }

    public static class RetryGiveupException
            extends ExecutionException
    {
        private final int retryCount;

        public RetryGiveupException(String message, Exception cause)
        {
            this(message, cause, 0);
        }

        public RetryGiveupException(Exception cause, int retryCount)
        {
            this(null, cause, retryCount);
        }

        private RetryGiveupException(String message, Exception cause, int retryCount)
        {
            super(message == null ? "Gave up after " + retryCount + " retries" : message, cause);
            this.retryCount = retryCount;
        }

        public int getRetryCount()
        {
            return retryCount;
        }

        @Override
        public Exception getCause()
        {
            return (Exception) super.getCause();
        }
    }

    public interface RetryPredicate
            extends Predicate<Exception>
    { }

    public interface RetryAction
    {
        void onRetry(Exception exception, int retryCount, int retryLimit, int retryWait);
    }

    public interface GiveupAction
    {
        void onGiveup(Exception firstException, Exception lastException);
    }

    public interface Sleeper
    {
        void sleep(long millis)
            throws InterruptedException;
    }

    private final int retryLimit;
    private final int initialRetryWait;
    private final int maxRetryWait;
    private final double waitGrowRate;
    private final RetryPredicate retryPredicate;
    private final RetryAction retryAction;
    private final GiveupAction giveupAction;
    private final Sleeper sleeper;

    private RetryExecutor()
    {
        this(3, 500, 30 * 1000, 2.0, null, null, null, Thread::sleep);
    }

    private RetryExecutor(int retryLimit, int initialRetryWait, int maxRetryWait, double waitGrowRate,
            RetryPredicate retryPredicate, RetryAction retryAction, GiveupAction giveupAction,
            Sleeper sleeper)
    {
        this.retryLimit = retryLimit;
        this.initialRetryWait = initialRetryWait;
        this.maxRetryWait = maxRetryWait;
        this.waitGrowRate = waitGrowRate;
        this.retryPredicate = retryPredicate;
        this.retryAction = retryAction;
        this.giveupAction = giveupAction;
        this.sleeper = sleeper;
    }

    public RetryExecutor withRetryLimit(int count)
    {
        return new RetryExecutor(
                count, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withInitialRetryWait(int msec)
    {
        return new RetryExecutor(
                retryLimit, msec, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withMaxRetryWait(int msec)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, msec, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withWaitGrowRate(double rate)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, rate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withSleeper(Sleeper sleeper)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor retryIf(RetryPredicate function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                function, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor onRetry(RetryAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, function, giveupAction, sleeper);
    }

    public RetryExecutor onGiveup(GiveupAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, function, sleeper);
    }

    public int getRetryLimit()
    {
        return retryLimit;
    }

    /**
     * Runs the operation. An interruption during a back-off wait gives up
     * immediately and keeps the thread's interrupted flag set.
     *
     * @throws RetryGiveupException when the operation failed with a non-retryable
     *         exception or kept failing after the retry limit. Its cause is the last failure.
     */
    public <T> T run(Callable<T> op)
            throws RetryGiveupException
    {
        int retryCount = 0;

        Exception firstException = null;

        while (true) {
            try {
                return op.call();
            }
            catch (Exception exception) {
                if (firstException == null) {
                    firstException = exception;
                }
                else if (firstException != exception) {
                    exception.addSuppressed(firstException);
                }
                if (retryCount >= retryLimit || retryPredicate == null || !retryPredicate.test(exception)) {
                    if (giveupAction != null) {
                        giveupAction.onGiveup(firstException, exception);
                    }
                    throw new RetryGiveupException(exception, retryCount);
                }

                // exponential back-off with hard limit
                int retryWait = (int) Math.min((double) maxRetryWait, initialRetryWait * Math.pow(waitGrowRate, retryCount));

                retryCount++;
                if (retryAction != null) {
                    retryAction.onRetry(exception, retryCount, retryLimit, retryWait);
                }

                try {
                    sleeper.sleep(retryWait);
                }
                catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new RetryGiveupException("Interrupted while waiting to retry", exception);
                }
            }
        }
    }

    public void run(Runnable op)
            throws RetryGiveupException
    {
        run(() -> {
            op.run();
            return (Void) null;
        });
    }
}
