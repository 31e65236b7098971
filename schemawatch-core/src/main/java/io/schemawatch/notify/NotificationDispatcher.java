package io.schemawatch.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Best-effort fan-out of events to every enabled channel.
 *
 * <p>Channels are attempted one after another; a failing channel is logged and the next one is
 * still attempted. Nothing is retried and nothing is thrown to the caller.
 */
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationChannel> channels;

    public NotificationDispatcher(List<NotificationChannel> channels) {
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels must not be null"));
    }

    public static NotificationDispatcher none() {
        return new NotificationDispatcher(List.of());
    }

    /**
     * @return number of enabled channels that completed delivery without throwing
     */
    public int dispatch(NotificationEvent event) {
        if (event == null) {
            return 0;
        }

        int delivered = 0;
        for (NotificationChannel channel : channels) {
            try {
                if (!channel.isEnabled()) {
                    continue;
                }
                channel.deliver(event);
                delivered++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("notification interrupted channel={} source={}", channel.name(), event.source());
                break;
            } catch (Exception e) {
                log.error("notification failed channel={} source={} status={} msg={}",
                        channel.name(), event.source(), event.status(), e.getMessage(), e);
            }
        }
        return delivered;
    }

    public List<NotificationChannel> channels() {
        return channels;
    }
}
