package io.conveyor.core.execution;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import io.conveyor.spi.SubmissionResult;
import org.junit.After;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

public class ExecutionBridgeTest
{
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private PrimaryRuntime runtime = null;

    @After
    public void shutdown()
    {
        if (runtime != null) {
            runtime.shutdown();
        }
    }

    @Test
    public void runOnCallingThreadWithoutRuntime()
            throws Exception
    {
        ExecutionBridge bridge = new ExecutionBridge();
        AtomicReference<Thread> thread = new AtomicReference<>();

        SubmissionResult result = bridge.submit("test", () -> {
            thread.set(Thread.currentThread());
            return SubmissionResult.accepted("run-1");
        }, TIMEOUT);

        assertThat(bridge.hasRuntime(), is(false));
        assertThat(result.getRunId().get(), is("run-1"));
        assertThat(thread.get(), is(Thread.currentThread()));
    }

    @Test
    public void runOnPrimaryRuntime()
            throws Exception
    {
        runtime = new PrimaryRuntime(1, 10);
        ExecutionBridge bridge = new ExecutionBridge(runtime);
        AtomicReference<String> threadName = new AtomicReference<>();

        SubmissionResult result = bridge.submit("test", () -> {
            threadName.set(Thread.currentThread().getName());
            return SubmissionResult.accepted("run-2");
        }, TIMEOUT);

        assertThat(bridge.hasRuntime(), is(true));
        assertThat(result.isAccepted(), is(true));
        assertThat(threadName.get(), startsWith("primary-runtime-"));
    }

    @Test
    public void timedOutTaskKeepsRunning()
            throws Exception
    {
        runtime = new PrimaryRuntime(1, 10);
        ExecutionBridge bridge = new ExecutionBridge(runtime);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);

        try {
            bridge.submit("slow", () -> {
                release.await(10, TimeUnit.SECONDS);
                finished.countDown();
                return SubmissionResult.accepted("late");
            }, Duration.ofMillis(100));
            fail();
        }
        catch (ExecutionSubmissionFailedException ex) {
            assertThat(ex.getMessage(), containsString("was not accepted within"));
        }

        release.countDown();
        assertThat(finished.await(10, TimeUnit.SECONDS), is(true));
    }

    @Test
    public void rejectedSubmissionFails()
    {
        ExecutionBridge bridge = new ExecutionBridge();
        try {
            bridge.submit("test", () -> SubmissionResult.rejected("queue is full"), TIMEOUT);
            fail();
        }
        catch (ExecutionSubmissionFailedException ex) {
            assertThat(ex.getMessage(), containsString("queue is full"));
        }
    }

    @Test
    public void missingResultFails()
    {
        ExecutionBridge bridge = new ExecutionBridge();
        try {
            bridge.submit("test", () -> null, TIMEOUT);
            fail();
        }
        catch (ExecutionSubmissionFailedException ex) {
            assertThat(ex.getMessage(), containsString("returned no result"));
        }
    }

    @Test
    public void exceptionOfTaskIsWrapped()
    {
        runtime = new PrimaryRuntime(1, 10);
        ExecutionBridge bridge = new ExecutionBridge(runtime);
        try {
            bridge.submit("test", () -> {
                throw new IllegalStateException("backend is down");
            }, TIMEOUT);
            fail();
        }
        catch (ExecutionSubmissionFailedException ex) {
            assertThat(ex.getCause(), instanceOf(IllegalStateException.class));
        }
    }

    @Test
    public void fallBackToCallingThreadAfterRuntimeShutdown()
            throws Exception
    {
        runtime = new PrimaryRuntime(1, 10);
        ExecutionBridge bridge = new ExecutionBridge(runtime);
        runtime.shutdown();

        AtomicReference<Thread> thread = new AtomicReference<>();
        bridge.submit("test", () -> {
            thread.set(Thread.currentThread());
            return SubmissionResult.accepted("run-3");
        }, TIMEOUT);

        assertThat(bridge.hasRuntime(), is(false));
        assertThat(thread.get(), is(Thread.currentThread()));
    }
}
