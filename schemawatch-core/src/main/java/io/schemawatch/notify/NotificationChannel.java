package io.schemawatch.notify;

/**
 * One delivery mechanism. A channel handles its own per-recipient failures; anything it throws is
 * logged by the {@link NotificationDispatcher}.
 */
public interface NotificationChannel {

    String name();

    boolean isEnabled();

    void deliver(NotificationEvent event) throws Exception;
}
