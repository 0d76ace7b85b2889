package io.verso.core.checkpoint;

import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.StateField;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/// A suspend/resume boundary waiting for one {@link ApprovalType}.
///
/// Entering evaluates the skip predicate and either passes through or produces the
/// reviewer payload. The definition never writes state: {@link #resumeUpdate} only
/// computes the update the engine merges when the reviewer answers.
///
/// ### Contracts
/// - **Postcondition**: {@link #enter} is a pure function of the state, so entering
///   twice without new input yields equal payloads
/// - **Postcondition**: {@link #resumeUpdate} always clears `awaitingApproval` and
///   `approvalType`
///
/// @implNote Immutable and thread-safe.
/// @see ReportCheckpoints for the pipeline's catalogue
public final class CheckpointDefinition {

    private final ApprovalType type;
    private final Predicate<WorkflowState> skipWhen;
    private final Map<String, Function<WorkflowState, Object>> projection;
    private final DecisionMapper decisionMapper;

    private CheckpointDefinition(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.skipWhen = Objects.requireNonNull(builder.skipWhen, "skipWhen must not be null");
        this.decisionMapper =
                Objects.requireNonNull(builder.decisionMapper, "decisionMapper must not be null");
        this.projection = Collections.unmodifiableMap(new LinkedHashMap<>(builder.projection));
    }

    public ApprovalType type() {
        return type;
    }

    public boolean shouldSkip(WorkflowState state) {
        return skipWhen.test(state);
    }

    /// Enters the checkpoint.
    ///
    /// @param state current run state, not null
    /// @return {@link CheckpointOutcome.Skipped} when the skip predicate holds, otherwise
    ///     {@link CheckpointOutcome.Suspended} with the payload
    public CheckpointOutcome enter(WorkflowState state) {
        if (shouldSkip(state)) {
            return new CheckpointOutcome.Skipped();
        }
        return new CheckpointOutcome.Suspended(payload(state));
    }

    /// Projects the fields the reviewer sees, in declaration order.
    public CheckpointPayload payload(WorkflowState state) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Function<WorkflowState, Object>> entry : projection.entrySet()) {
            fields.put(entry.getKey(), entry.getValue().apply(state));
        }
        return new CheckpointPayload(type, type.phase(), fields);
    }

    /// Computes the update merged when the reviewer answers.
    ///
    /// @param state state of the suspended run, not null
    /// @param decision reviewer answer for this checkpoint, not null
    /// @return the mapped decision plus the release of the pending approval
    /// @throws IllegalArgumentException if the decision answers another approval type
    public StateUpdate resumeUpdate(WorkflowState state, HumanDecision decision) {
        if (decision.approvalType() != type) {
            throw new IllegalArgumentException(
                    "Decision for " + decision.approvalType() + " cannot resume checkpoint " + type);
        }
        return StateUpdate.builder()
                .include(decisionMapper.toUpdate(state, decision))
                .set(ReportFields.AWAITING_APPROVAL, Boolean.FALSE)
                .clear(ReportFields.APPROVAL_TYPE)
                .build();
    }

    public static Builder builder(ApprovalType type) {
        return new Builder(type);
    }

    /// Builder for {@link CheckpointDefinition}. Required: skip predicate and decision mapper.
    public static final class Builder {
        private final ApprovalType type;
        private final Map<String, Function<WorkflowState, Object>> projection = new LinkedHashMap<>();
        private Predicate<WorkflowState> skipWhen;
        private DecisionMapper decisionMapper;

        private Builder(ApprovalType type) {
            this.type = type;
        }

        public Builder skipWhen(Predicate<WorkflowState> skipWhen) {
            this.skipWhen = skipWhen;
            return this;
        }

        /// Adds state fields to the payload under their own names.
        public Builder show(StateField<?, ?>... fields) {
            for (StateField<?, ?> field : fields) {
                projection.put(field.name(), state -> state.get(field.name()));
            }
            return this;
        }

        /// Adds a derived payload entry.
        public Builder show(String name, Function<WorkflowState, Object> value) {
            projection.put(name, value);
            return this;
        }

        public Builder message(String message) {
            projection.put("message", state -> message);
            return this;
        }

        public Builder decisionMapper(DecisionMapper decisionMapper) {
            this.decisionMapper = decisionMapper;
            return this;
        }

        public CheckpointDefinition build() {
            return new CheckpointDefinition(this);
        }
    }
}
