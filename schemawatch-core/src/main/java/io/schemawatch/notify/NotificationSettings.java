package io.schemawatch.notify;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide channel configuration. Channels read it at delivery time, so updates apply to the
 * next notification without restarting either loop.
 */
public class NotificationSettings {

    private final AtomicReference<EmailSettings> email;
    private final AtomicReference<WebhookSettings> webhook;

    public NotificationSettings() {
        this(EmailSettings.disabled(), WebhookSettings.disabled());
    }

    public NotificationSettings(EmailSettings email, WebhookSettings webhook) {
        this.email = new AtomicReference<>(Objects.requireNonNull(email, "email must not be null"));
        this.webhook = new AtomicReference<>(Objects.requireNonNull(webhook, "webhook must not be null"));
    }

    public EmailSettings email() {
        return email.get();
    }

    public WebhookSettings webhook() {
        return webhook.get();
    }

    public void updateEmail(EmailSettings settings) {
        email.set(Objects.requireNonNull(settings, "settings must not be null"));
    }

    public void updateWebhook(WebhookSettings settings) {
        webhook.set(Objects.requireNonNull(settings, "settings must not be null"));
    }
}
