package io.schemawatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemawatch.JobHandler;
import io.schemawatch.JobScheduler;
import io.schemawatch.SchemaMonitor;
import io.schemawatch.core.JobHandlerRegistry;
import io.schemawatch.internal.jdbc.JdbcStore;
import io.schemawatch.notify.NotificationDispatcher;
import io.schemawatch.notify.NotificationSettings;
import io.schemawatch.spi.JobRepository;
import io.schemawatch.spi.SnapshotRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaWatchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SchemaWatchAutoConfiguration.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(JobHandler.class, DemoJobHandler::new)
            .withPropertyValues(
                    "schemawatch.jdbc-url=jdbc:h2:mem:autoconfig-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                    "schemawatch.scheduler.tick-interval=1h",
                    "schemawatch.monitor.interval=1h",
                    "schemawatch.notifications.webhook.enabled=true",
                    "schemawatch.notifications.webhook.urls[0]=http://127.0.0.1:1/hook",
                    "schemawatch.notifications.webhook.timeout=5s"
            );

    @Test
    void shouldAutoConfigureSchemaWatchBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JdbcStore.class);
            assertThat(context).hasSingleBean(JobRepository.class);
            assertThat(context).hasSingleBean(SnapshotRepository.class);
            assertThat(context).hasSingleBean(JobScheduler.class);
            assertThat(context).hasBean("jobSchedulerLifecycle");
            assertThat(context).hasSingleBean(SchemaMonitor.class);
            assertThat(context).hasBean("schemaMonitorLifecycle");
            assertThat(context.getBean("schemaMonitorLifecycle", LoopLifecycle.class).getPhase())
                    .isLessThan(context.getBean("jobSchedulerLifecycle", LoopLifecycle.class).getPhase());
            assertThat(context).hasSingleBean(NotificationDispatcher.class);
            assertThat(context).hasSingleBean(SchemaWatchProperties.class);

            assertThat(context.getBean(NotificationDispatcher.class).channels()).hasSize(2);
            NotificationSettings settings = context.getBean(NotificationSettings.class);
            assertThat(settings.webhook().enabled()).isTrue();
            assertThat(settings.webhook().urls()).containsExactly("http://127.0.0.1:1/hook");
            assertThat(settings.email().enabled()).isFalse();
        });
    }

    @Test
    void schedulerShouldBeStartedAndUsable() {
        contextRunner.run(context -> {
            JobScheduler scheduler = context.getBean(JobScheduler.class);
            assertThat(scheduler.isRunning()).isTrue();
            assertThat(context.getBean(JobHandlerRegistry.class).isRegistered("demo")).isTrue();

            String id = scheduler.addJob("demo job", "demo", "every_30_minutes", Map.of("message", "hi"));

            assertThat(scheduler.findJob(id)).isPresent();
            assertThat(scheduler.listJobs()).hasSize(1);
            assertThat(scheduler.triggerNow(id)).isTrue();
        });
    }

    @Test
    void monitorShouldPickUpConfiguredDatabases() {
        contextRunner
                .withPropertyValues(
                        "schemawatch.monitor.databases[0].name=sales",
                        "schemawatch.monitor.databases[0].url=jdbc:h2:mem:sales-monitored",
                        "schemawatch.monitor.databases[0].username=sa",
                        "schemawatch.monitor.databases[1].name=sales",
                        "schemawatch.monitor.databases[1].connection-id=replica",
                        "schemawatch.monitor.databases[1].method=service-principal",
                        "schemawatch.monitor.databases[1].url=jdbc:sqlserver://replica",
                        "schemawatch.monitor.databases[1].client-id=app",
                        "schemawatch.monitor.databases[1].client-secret=secret"
                )
                .run(context -> {
                    SchemaMonitor monitor = context.getBean(SchemaMonitor.class);
                    assertThat(monitor.isRunning()).isTrue();
                    assertThat(monitor.databases())
                            .extracting(db -> db.connectionId())
                            .containsExactly("default", "replica");
                });
    }

    @Test
    void monitorCanBeDisabled() {
        contextRunner
                .withPropertyValues("schemawatch.monitor.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(SchemaMonitor.class);
                    assertThat(context).doesNotHaveBean("schemaMonitorLifecycle");
                    assertThat(context).hasBean("jobSchedulerLifecycle");
                    assertThat(context).hasSingleBean(JobScheduler.class);
                });
    }

    @Test
    void everythingCanBeDisabled() {
        contextRunner
                .withPropertyValues("schemawatch.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JobScheduler.class);
                    assertThat(context).doesNotHaveBean(JdbcStore.class);
                });
    }

    static class DemoJobHandler implements JobHandler<Map<String, Object>> {
        @Override
        public String type() {
            return "demo";
        }

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> configClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public Object execute(Map<String, Object> config) {
            return config;
        }
    }
}
