package io.schemawatch.config;

import io.schemawatch.core.ConnectionMethod;
import io.schemawatch.core.MonitoredDatabase;
import io.schemawatch.notify.EmailSettings;
import io.schemawatch.notify.WebhookSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration for the scheduler, the schema monitor and notifications.
 */
@ConfigurationProperties(prefix = "schemawatch")
public class SchemaWatchProperties {
    private boolean enabled = true;
    private String jdbcUrl = "jdbc:h2:file:./scheduler/jobs";
    private String username = "sa";
    private String password = "";
    private int maxPoolSize = 5;
    private boolean ensureSchemaOnStartup = true;
    private int historyLimit = 50;
    private String zone; // null = system default

    private final Scheduler scheduler = new Scheduler();
    private final Monitor monitor = new Monitor();
    private final Notifications notifications = new Notifications();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public boolean isEnsureSchemaOnStartup() {
        return ensureSchemaOnStartup;
    }

    public void setEnsureSchemaOnStartup(boolean ensureSchemaOnStartup) {
        this.ensureSchemaOnStartup = ensureSchemaOnStartup;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    /**
     * Zone used for {@code HH:MM} schedules, or null for the clock's zone.
     */
    public ZoneId resolveZone() {
        return (zone == null || zone.isBlank()) ? null : ZoneId.of(zone);
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public static class Scheduler {
        private Duration tickInterval = Duration.ofMinutes(1);

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }
    }

    public static class Monitor {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
        private int retention = 100; // snapshots per database connection
        private boolean notifyOnError = true;
        private List<Database> databases = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getRetention() {
            return retention;
        }

        public void setRetention(int retention) {
            this.retention = retention;
        }

        public boolean isNotifyOnError() {
            return notifyOnError;
        }

        public void setNotifyOnError(boolean notifyOnError) {
            this.notifyOnError = notifyOnError;
        }

        public List<Database> getDatabases() {
            return databases;
        }

        public void setDatabases(List<Database> databases) {
            this.databases = databases;
        }
    }

    /**
     * A database to monitor from the moment the monitor bean is created.
     */
    public static class Database {
        private String name;
        private String connectionId;
        private String method;
        private String url;
        private String username;
        private String password;
        private String clientId;
        private String clientSecret;
        private String tenantId;

        public MonitoredDatabase toMonitoredDatabase() {
            return new MonitoredDatabase(name, connectionId, ConnectionMethod.fromCode(method), url,
                    username, password, clientId, clientSecret, tenantId);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getConnectionId() {
            return connectionId;
        }

        public void setConnectionId(String connectionId) {
            this.connectionId = connectionId;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }
    }

    public static class Notifications {
        private final Email email = new Email();
        private final Webhook webhook = new Webhook();

        public Email getEmail() {
            return email;
        }

        public Webhook getWebhook() {
            return webhook;
        }
    }

    public static class Email {
        private boolean enabled = false;
        private String smtpHost;
        private int smtpPort = EmailSettings.DEFAULT_SMTP_PORT;
        private String username;
        private String password;
        private boolean startTls = true;
        private String from;
        private List<String> to = new ArrayList<>();

        public EmailSettings toSettings() {
            return new EmailSettings(enabled, smtpHost, smtpPort, username, password, startTls, from, to);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSmtpHost() {
            return smtpHost;
        }

        public void setSmtpHost(String smtpHost) {
            this.smtpHost = smtpHost;
        }

        public int getSmtpPort() {
            return smtpPort;
        }

        public void setSmtpPort(int smtpPort) {
            this.smtpPort = smtpPort;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean isStartTls() {
            return startTls;
        }

        public void setStartTls(boolean startTls) {
            this.startTls = startTls;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public List<String> getTo() {
            return to;
        }

        public void setTo(List<String> to) {
            this.to = to;
        }
    }

    public static class Webhook {
        private boolean enabled = false;
        private List<String> urls = new ArrayList<>();
        private Duration timeout = WebhookSettings.DEFAULT_TIMEOUT;

        public WebhookSettings toSettings() {
            return new WebhookSettings(enabled, urls, timeout);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
