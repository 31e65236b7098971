package io.schemawatch.notify;

import java.time.Duration;
import java.util.List;

public record WebhookSettings(boolean enabled, List<String> urls, Duration timeout) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public WebhookSettings {
        urls = urls == null ? List.of() : List.copyOf(urls);
        timeout = (timeout == null || timeout.isZero() || timeout.isNegative()) ? DEFAULT_TIMEOUT : timeout;
    }

    public static WebhookSettings disabled() {
        return new WebhookSettings(false, List.of(), DEFAULT_TIMEOUT);
    }
}
