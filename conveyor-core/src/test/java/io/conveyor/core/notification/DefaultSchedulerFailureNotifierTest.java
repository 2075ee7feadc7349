package io.conveyor.core.notification;

import java.util.ArrayList;
import java.util.List;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.name.Names;
import io.conveyor.core.database.DatabaseTestingUtils;
import io.conveyor.spi.FailureNotification;
import io.conveyor.spi.FailureNotificationSender;
import io.conveyor.spi.NotificationException;
import io.conveyor.spi.config.Config;
import io.conveyor.util.RetryExecutor;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.conveyor.util.RetryExecutor.retryExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@RunWith(MockitoJUnitRunner.class)
public class DefaultSchedulerFailureNotifierTest
{
    @Mock FailureNotificationSender sender;

    private List<Long> waits;
    private RetryExecutor retry;

    @Before
    public void setUp()
    {
        waits = new ArrayList<>();
        retry = retryExecutor()
            .withRetryLimit(3)
            .withInitialRetryWait(10)
            .withMaxRetryWait(100)
            .withSleeper(waits::add);
    }

    @Test
    public void sendNotification()
            throws Exception
    {
        new DefaultSchedulerFailureNotifier(sender, retry).notifySchedulerFailure("etl", "backend is down");

        ArgumentCaptor<FailureNotification> captor = ArgumentCaptor.forClass(FailureNotification.class);
        verify(sender).sendNotification(captor.capture());
        assertThat(captor.getValue().getPipelineName(), is("etl"));
        assertThat(captor.getValue().getMessage(), is("backend is down"));
        assertThat(waits.isEmpty(), is(true));
    }

    @Test
    public void retryFailedSend()
            throws Exception
    {
        doThrow(new NotificationException("connection refused"))
            .doNothing()
            .when(sender).sendNotification(any(FailureNotification.class));

        new DefaultSchedulerFailureNotifier(sender, retry).notifySchedulerFailure("etl", "backend is down");

        verify(sender, times(2)).sendNotification(any(FailureNotification.class));
        assertThat(waits.size(), is(1));
    }

    @Test
    public void giveUpWithoutThrowing()
            throws Exception
    {
        doThrow(new NotificationException("connection refused"))
            .when(sender).sendNotification(any(FailureNotification.class));

        new DefaultSchedulerFailureNotifier(sender, retry).notifySchedulerFailure("etl", "backend is down");

        verify(sender, times(4)).sendNotification(any(FailureNotification.class));
        assertThat(waits.size(), is(3));
    }

    @Test
    public void senderIsChosenByNotificationType()
            throws Exception
    {
        Config config = DatabaseTestingUtils.createConfig()
            .set("notification.type", "mail")
            .set("notification.retries", 0);
        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(FailureNotificationSender.class).annotatedWith(Names.named("mail")).toInstance(sender);
            }
        });

        new DefaultSchedulerFailureNotifier(config, injector).notifySchedulerFailure("etl", "backend is down");

        verify(sender).sendNotification(any(FailureNotification.class));
    }

    @Test
    public void withoutNotificationTypeNothingIsSent()
    {
        Injector injector = Guice.createInjector();
        // logged only
        new DefaultSchedulerFailureNotifier(DatabaseTestingUtils.createConfig(), injector)
            .notifySchedulerFailure("etl", "backend is down");
    }
}
