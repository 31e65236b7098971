package io.schemawatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemawatch.JobHandler;
import io.schemawatch.JobScheduler;
import io.schemawatch.SchemaMonitor;
import io.schemawatch.core.JobHandlerRegistry;
import io.schemawatch.internal.PollingJobScheduler;
import io.schemawatch.internal.PollingSchemaMonitor;
import io.schemawatch.internal.jdbc.JdbcDatabaseConnector;
import io.schemawatch.internal.jdbc.JdbcJobRepository;
import io.schemawatch.internal.jdbc.JdbcMetadataSchemaExtractor;
import io.schemawatch.internal.jdbc.JdbcSchemaInitializer;
import io.schemawatch.internal.jdbc.JdbcSnapshotRepository;
import io.schemawatch.internal.jdbc.JdbcStore;
import io.schemawatch.notify.EmailNotificationChannel;
import io.schemawatch.notify.NotificationChannel;
import io.schemawatch.notify.NotificationDispatcher;
import io.schemawatch.notify.NotificationSettings;
import io.schemawatch.notify.WebhookNotificationChannel;
import io.schemawatch.schema.SchemaFingerprinter;
import io.schemawatch.spi.DatabaseConnector;
import io.schemawatch.spi.JobRepository;
import io.schemawatch.spi.SchemaExtractor;
import io.schemawatch.spi.SnapshotRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler, the schema monitor and
 * notifications.
 */
@AutoConfiguration
@ConditionalOnClass({JobScheduler.class, JdbcStore.class})
@EnableConfigurationProperties(SchemaWatchProperties.class)
@ConditionalOnProperty(prefix = "schemawatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchemaWatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JdbcStore schemaWatchStore(SchemaWatchProperties props) {
        return JdbcStore.open(props);
    }

    @Bean
    @ConditionalOnMissingBean
    protected JdbcSchemaInitializer jdbcSchemaInitializer(JdbcStore store) {
        return new JdbcSchemaInitializer(store.dataSource());
    }

    @Bean
    @ConditionalOnProperty(prefix = "schemawatch", name = "ensure-schema-on-startup", havingValue = "true",
            matchIfMissing = true)
    public SmartInitializingSingleton schemaWatchTablesInitializer(JdbcSchemaInitializer initializer) {
        return initializer::ensureSchema;
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRepository jobRepository(JdbcStore store, ObjectProvider<ObjectMapper> objectMapper) {
        return new JdbcJobRepository(store.dataSource(), mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotRepository snapshotRepository(JdbcStore store, ObjectProvider<ObjectMapper> objectMapper) {
        return new JdbcSnapshotRepository(store.dataSource(), mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSettings notificationSettings(SchemaWatchProperties props) {
        return new NotificationSettings(
                props.getNotifications().getEmail().toSettings(),
                props.getNotifications().getWebhook().toSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailNotificationChannel emailNotificationChannel(NotificationSettings settings,
                                                             ObjectProvider<ObjectMapper> objectMapper) {
        return new EmailNotificationChannel(settings, mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookNotificationChannel webhookNotificationChannel(NotificationSettings settings,
                                                                 ObjectProvider<ObjectMapper> objectMapper) {
        return new WebhookNotificationChannel(settings, mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(ObjectProvider<NotificationChannel> channels) {
        return new NotificationDispatcher(channels.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(SchemaWatchProperties props,
                                     JobRepository jobRepository,
                                     JobHandlerRegistry registry,
                                     NotificationDispatcher dispatcher,
                                     ObjectProvider<ObjectMapper> objectMapper) {
        return new PollingJobScheduler(props, jobRepository, registry, dispatcher, mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean(name = "jobSchedulerLifecycle")
    public LoopLifecycle jobSchedulerLifecycle(JobScheduler scheduler) {
        return new LoopLifecycle("scheduler", scheduler::start, scheduler::stop, LoopLifecycle.SCHEDULER_PHASE);
    }

    private static ObjectMapper mapper(ObjectProvider<ObjectMapper> objectMapper) {
        return objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
    }

    /**
     * Schema drift monitoring, switched off with {@code schemawatch.monitor.enabled=false}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "schemawatch.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MonitorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DatabaseConnector databaseConnector() {
            return new JdbcDatabaseConnector();
        }

        @Bean
        @ConditionalOnMissingBean
        public SchemaExtractor schemaExtractor() {
            return new JdbcMetadataSchemaExtractor();
        }

        @Bean
        @ConditionalOnMissingBean
        public SchemaFingerprinter schemaFingerprinter(ObjectProvider<ObjectMapper> objectMapper) {
            return new SchemaFingerprinter(mapper(objectMapper));
        }

        @Bean
        @ConditionalOnMissingBean
        public SchemaMonitor schemaMonitor(SchemaWatchProperties props,
                                           SnapshotRepository snapshotRepository,
                                           DatabaseConnector connector,
                                           SchemaExtractor extractor,
                                           SchemaFingerprinter fingerprinter,
                                           NotificationDispatcher dispatcher) {
            PollingSchemaMonitor monitor = new PollingSchemaMonitor(props, snapshotRepository, connector, extractor,
                    fingerprinter, dispatcher);
            props.getMonitor().getDatabases().forEach(db -> monitor.addDatabase(db.toMonitoredDatabase()));
            return monitor;
        }

        @Bean
        @ConditionalOnMissingBean(name = "schemaMonitorLifecycle")
        public LoopLifecycle schemaMonitorLifecycle(SchemaMonitor monitor) {
            return new LoopLifecycle("monitor", monitor::start, monitor::stop, LoopLifecycle.MONITOR_PHASE);
        }
    }
}
