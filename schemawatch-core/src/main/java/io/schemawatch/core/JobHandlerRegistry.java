package io.schemawatch.core;

import io.schemawatch.JobFunction;
import io.schemawatch.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps job type names to handlers.
 *
 * <p>Registering a type name twice replaces the earlier handler. Callers sharing one registry must
 * agree on type names themselves.
 */
public class JobHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<String, JobHandler<?>> handlersByType = new ConcurrentHashMap<>();

    public JobHandlerRegistry() {
    }

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        if (handlers != null) {
            handlers.forEach(this::register);
        }
    }

    public void register(JobHandler<?> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        register(handler.type(), handler);
    }

    public void register(String type, JobHandler<?> handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("job type must not be blank");
        }
        Objects.requireNonNull(handler, "handler must not be null");

        JobHandler<?> previous = handlersByType.put(type, handler);
        if (previous != null && previous != handler) {
            log.info("Replaced job type handler type={}", type);
        } else {
            log.info("Registered job type type={}", type);
        }
    }

    public void register(String type, JobFunction function) {
        Objects.requireNonNull(function, "function must not be null");
        register(type, new FunctionJobHandler(type, function));
    }

    public boolean isRegistered(String type) {
        return type != null && handlersByType.containsKey(type);
    }

    public Optional<JobHandler<?>> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlersByType.get(type));
    }

    public JobHandler<?> getRequired(String type) {
        return find(type).orElseThrow(() -> new JobConfigurationException("Unknown job type: " + type));
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(handlersByType.keySet());
    }

    private record FunctionJobHandler(String type, JobFunction function) implements JobHandler<Map<String, Object>> {

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> configClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public Object execute(Map<String, Object> config) throws Exception {
            return function.apply(config);
        }
    }
}
