package io.verso.core;

import io.verso.core.evaluation.QualityRubric;
import io.verso.core.pipeline.ArtifactKind;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Tuning options of the pipeline engine.
///
/// ### Default Values
/// - `threadPoolSize`: number of available processors
/// - `subStepTimeout`: 5 minutes
/// - `maxSteps`: 500 steps per drive of the control loop
/// - `revisionCaps`: {@link ArtifactKind#defaultCap()} per kind
/// - `structuralThreshold`: {@link QualityRubric#DEFAULT_THRESHOLD}
///
/// @implNote Immutable and thread-safe.
/// @see VersoFactory.Builder#config(EngineConfig)
public final class EngineConfig {

    private final int threadPoolSize;
    private final Duration subStepTimeout;
    private final int maxSteps;
    private final Map<ArtifactKind, Integer> revisionCaps;
    private final double structuralThreshold;

    private EngineConfig(Builder builder) {
        this.threadPoolSize = builder.threadPoolSize;
        this.subStepTimeout = builder.subStepTimeout;
        this.maxSteps = builder.maxSteps;
        this.revisionCaps = Collections.unmodifiableMap(new EnumMap<>(builder.revisionCaps));
        this.structuralThreshold = builder.structuralThreshold;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Returns how long one sub-step of a scatter-gather may run before it resolves to
    /// a timeout failure.
    public Duration getSubStepTimeout() {
        return subStepTimeout;
    }

    /// Returns the step limit guarding against routing loops.
    public int getMaxSteps() {
        return maxSteps;
    }

    /// Returns the automatic revision cap of `kind`.
    public int getRevisionCap(ArtifactKind kind) {
        return revisionCaps.getOrDefault(kind, kind.defaultCap());
    }

    public Map<ArtifactKind, Integer> getRevisionCaps() {
        return revisionCaps;
    }

    public double getStructuralThreshold() {
        return structuralThreshold;
    }

    /// Builder for {@link EngineConfig}.
    public static final class Builder {
        private int threadPoolSize = Runtime.getRuntime().availableProcessors();
        private Duration subStepTimeout = Duration.ofMinutes(5);
        private int maxSteps = 500;
        private final Map<ArtifactKind, Integer> revisionCaps = new EnumMap<>(ArtifactKind.class);
        private double structuralThreshold = QualityRubric.DEFAULT_THRESHOLD;

        private Builder() {}

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder subStepTimeout(Duration subStepTimeout) {
            this.subStepTimeout = subStepTimeout;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder revisionCap(ArtifactKind kind, int cap) {
            revisionCaps.put(Objects.requireNonNull(kind, "kind must not be null"), cap);
            return this;
        }

        public Builder structuralThreshold(double structuralThreshold) {
            this.structuralThreshold = structuralThreshold;
            return this;
        }

        /// Builds the configuration.
        ///
        /// @throws IllegalArgumentException if a value is out of range
        public EngineConfig build() {
            if (threadPoolSize < 1) {
                throw new IllegalArgumentException("threadPoolSize must be positive");
            }
            Objects.requireNonNull(subStepTimeout, "subStepTimeout must not be null");
            if (subStepTimeout.isNegative() || subStepTimeout.isZero()) {
                throw new IllegalArgumentException("subStepTimeout must be positive");
            }
            if (maxSteps < 1) {
                throw new IllegalArgumentException("maxSteps must be positive");
            }
            revisionCaps.forEach(
                    (kind, cap) -> {
                        if (cap < 0) {
                            throw new IllegalArgumentException(
                                    "Revision cap for " + kind + " must be >= 0");
                        }
                    });
            if (structuralThreshold <= 0.0 || structuralThreshold > 1.0) {
                throw new IllegalArgumentException("structuralThreshold must be in (0, 1]");
            }
            return new EngineConfig(this);
        }
    }
}
