package io.verso.core.execution;

import io.verso.core.EngineConfig;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/// Services available to a node while it executes.
///
/// Nodes obtain external collaborators (model clients, fetchers, scorers) through
/// {@link #service(Class)}, so tests can run the same nodes against fakes.
///
/// ### Required Fields
/// - `runId`
/// - `executorService` - pool used by scatter-gather sub-steps
///
/// @implNote Immutable after construction. Thread-safe for read access.
/// @see io.verso.core.execution.node.PipelineNode
public final class NodeContext {

    private final String runId;
    private final ExecutorService executorService;
    private final CancellationSignal cancellationSignal;
    private final EngineConfig config;
    private final PipelineListener listener;
    private final Map<Class<?>, Object> services;

    private NodeContext(Builder builder) {
        this.runId = builder.runId;
        this.executorService = builder.executorService;
        this.cancellationSignal = builder.cancellationSignal;
        this.config = builder.config;
        this.listener = builder.listener;
        this.services = Collections.unmodifiableMap(new HashMap<>(builder.services));
    }

    public String getRunId() {
        return runId;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /// Returns the listener (defaults to {@link PipelineListener#NOOP}).
    public PipelineListener getListener() {
        return listener;
    }

    /// Looks up a registered service.
    ///
    /// @param type service type, not null
    /// @return the service, empty when none is registered
    public <T> Optional<T> findService(Class<T> type) {
        return Optional.ofNullable(services.get(type)).map(type::cast);
    }

    /// Returns a registered service.
    ///
    /// @throws IllegalStateException if no service of `type` is registered
    public <T> T service(Class<T> type) {
        return findService(type)
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "No service registered for " + type.getSimpleName()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link NodeContext}. Required: `runId`, `executorService`.
    public static final class Builder {
        private String runId;
        private ExecutorService executorService;
        private CancellationSignal cancellationSignal = CancellationSignal.create();
        private EngineConfig config = EngineConfig.defaults();
        private PipelineListener listener = PipelineListener.NOOP;
        private final Map<Class<?>, Object> services = new HashMap<>();

        private Builder() {}

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder cancellationSignal(CancellationSignal cancellationSignal) {
            this.cancellationSignal = cancellationSignal;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder listener(PipelineListener listener) {
            this.listener = listener;
            return this;
        }

        public <T> Builder service(Class<T> type, T service) {
            services.put(
                    Objects.requireNonNull(type, "type must not be null"),
                    Objects.requireNonNull(service, "service must not be null"));
            return this;
        }

        /// Copies every entry of `services` into this builder.
        public Builder services(Map<Class<?>, Object> services) {
            services.forEach(
                    (type, service) -> {
                        if (!type.isInstance(service)) {
                            throw new IllegalArgumentException(
                                    "Service " + service + " is not a " + type.getSimpleName());
                        }
                        this.services.put(type, service);
                    });
            return this;
        }

        /// @throws NullPointerException if a required field is missing
        public NodeContext build() {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(executorService, "executorService must not be null");
            Objects.requireNonNull(cancellationSignal, "cancellationSignal must not be null");
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(listener, "listener must not be null");
            return new NodeContext(this);
        }
    }
}
