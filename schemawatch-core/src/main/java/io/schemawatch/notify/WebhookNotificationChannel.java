package io.schemawatch.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * POSTs {@code {source, status, timestamp, payload}} as JSON to every configured URL.
 */
public class WebhookNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final NotificationSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookNotificationChannel(NotificationSettings settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public WebhookNotificationChannel(NotificationSettings settings, ObjectMapper objectMapper, HttpClient httpClient) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return settings.webhook().enabled();
    }

    @Override
    public void deliver(NotificationEvent event) throws Exception {
        WebhookSettings webhook = settings.webhook();
        if (!webhook.enabled() || webhook.urls().isEmpty()) {
            return;
        }

        String json = objectMapper.writeValueAsString(toPayload(event));

        int sent = 0;
        for (String url : webhook.urls()) {
            try {
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(url))
                        .timeout(webhook.timeout())
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                        .build();

                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int code = response.statusCode();
                if (code < 200 || code >= 300) {
                    log.error("webhook notification rejected url={} source={} httpStatus={}", url, event.source(), code);
                    continue;
                }
                sent++;
            } catch (IOException | IllegalArgumentException e) {
                log.error("webhook notification failed url={} source={} msg={}", url, event.source(), e.getMessage(), e);
            }
        }
        log.info("webhook notification sent source={} status={} urls={}/{}",
                event.source(), event.status(), sent, webhook.urls().size());
    }

    ObjectNode toPayload(NotificationEvent event) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("source", event.source());
        body.put("status", event.status());
        body.put("timestamp", event.timestamp().toString());
        body.set("payload", objectMapper.valueToTree(event.payload()));
        return body;
    }
}
