package io.conveyor.spi;

/**
 * Delivers failure notifications through one transport. Senders are bound with
 * {@code @Named(type)} and chosen by the {@code notification.type} parameter.
 */
public interface FailureNotificationSender
{
    void sendNotification(FailureNotification notification)
        throws NotificationException;
}
