package io.verso.core.execution;

import io.verso.core.EngineConfig;
import io.verso.core.checkpoint.CheckpointDefinition;
import io.verso.core.checkpoint.CheckpointOutcome;
import io.verso.core.checkpoint.CheckpointPayload;
import io.verso.core.checkpoint.CheckpointRegistry;
import io.verso.core.checkpoint.HumanDecision;
import io.verso.core.evaluation.Evaluation;
import io.verso.core.evaluation.EvaluationRecord;
import io.verso.core.exception.InvalidRollbackPointException;
import io.verso.core.exception.RunNotFoundException;
import io.verso.core.exception.StateContractException;
import io.verso.core.execution.node.NodeRegistry;
import io.verso.core.execution.node.PipelineNode;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ErrorRecord;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.pipeline.StepKind;
import io.verso.core.rollback.RollbackPlan;
import io.verso.core.rollback.RollbackService;
import io.verso.core.rollback.RollbackTable;
import io.verso.core.routing.PhaseRouter;
import io.verso.core.routing.ReportRouter;
import io.verso.core.state.StateSchema;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import io.verso.core.storage.RunSnapshot;
import io.verso.core.storage.RunStateRepository;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Control loop of the report pipeline.
///
/// Each iteration asks the router for the next step, runs it and merges its update:
/// a node returns a partial update, a checkpoint either passes through or suspends the
/// run. The merged state is persisted after every step, so any snapshot can be resumed
/// with {@link #advance(String)}.
///
/// ### Contracts
/// - **Invariant**: one step executes at a time per run; the router only sees fully
///   merged state
/// - **Postcondition**: every returned {@link RunResult} has been persisted
/// - **Postcondition**: contract violations ({@link StateContractException}) propagate to
///   the caller and are never recorded in `errors`
///
/// ### Failure handling
/// A node exception is appended to `errors` as `<step>-failed`. On the generation,
/// revision or evaluation step of a revisable artifact it is also recorded as a
/// non-ready evaluation of the current attempt, so the revision gate revises or
/// escalates. Any other failure moves the run to the `error` phase, keeping the
/// previous phase in `lastGoodPhase`.
///
/// @implNote Thread-safe for distinct runs. Driving the same run from two threads at
/// once is rejected.
/// @see PhaseRouter
/// @see NodeRegistry
/// @see CheckpointRegistry
public final class PipelineEngine {

    private static final Logger logger = Logger.getLogger(PipelineEngine.class.getName());

    private final StateSchema schema;
    private final PhaseRouter router;
    private final NodeRegistry nodeRegistry;
    private final CheckpointRegistry checkpointRegistry;
    private final RunStateRepository repository;
    private final RollbackService rollbackService;
    private final ExecutorService executorService;
    private final EngineConfig config;
    private final PipelineListener listener;
    private final Map<Class<?>, Object> services;
    private final Map<String, CancellationSignal> activeRuns = new ConcurrentHashMap<>();

    private PipelineEngine(Builder builder) {
        this.schema = builder.schema;
        this.router = builder.router;
        this.nodeRegistry = builder.nodeRegistry;
        this.checkpointRegistry = builder.checkpointRegistry;
        this.repository = builder.repository;
        this.rollbackService = builder.rollbackService;
        this.executorService = builder.executorService;
        this.config = builder.config;
        this.listener = builder.listener;
        this.services = Map.copyOf(builder.services);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Starts a new run from its initial input.
    ///
    /// @param runId unique run identifier, not null
    /// @param initialInput field name to value, applied to the default state through the
    ///     fields' reducers, not null
    /// @return the outcome of the first drive, never null
    /// @throws IllegalStateException if a run with `runId` already exists
    /// @throws StateContractException if the input names an undeclared field or has an
    ///     ill-typed value
    public RunResult start(String runId, Map<String, ?> initialInput) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(initialInput, "initialInput must not be null");
        WorkflowState state = schema.defaultState().apply(StateUpdate.fromMap(schema, initialInput));
        if (state.get(ReportFields.SESSION_ID) == null) {
            state = state.apply(StateUpdate.builder().set(ReportFields.SESSION_ID, runId).build());
        }
        CancellationSignal signal = reserve(runId);
        try {
            if (repository.findByRunId(runId).isPresent()) {
                throw new IllegalStateException("Run already exists: " + runId);
            }
            repository.save(RunSnapshot.from(runId, state, "start"));
            logger.info("Started run " + runId);
            return drive(runId, state, signal);
        } finally {
            release(runId, signal);
        }
    }

    /// Merges a reviewer decision into a suspended run and continues it.
    ///
    /// What a decision without fields does depends on the checkpoint. At a data or
    /// artifact-review checkpoint (`await-full-context`, `paper-evidence-selection`,
    /// `await-roster`, `character-ids`, `arc-selection`, `outline`, `article`) it changes
    /// nothing, so the run re-enters the same checkpoint and suspends again with an equal
    /// payload. At an approval checkpoint (`input-review`, `pre-curation`,
    /// `evidence-and-photos`) a missing `approved` field counts as approval; only an
    /// explicit `approved: false` keeps the run waiting.
    ///
    /// @param runId suspended run, not null
    /// @param decision reviewer answer, not null
    /// @return the outcome of the continued drive, never null
    /// @throws RunNotFoundException if no run with `runId` was persisted
    /// @throws IllegalStateException if the run is not suspended
    /// @throws IllegalArgumentException if the decision answers another checkpoint or
    ///     carries unexpected fields
    /// @throws IllegalStateException if the run is being driven by another call
    public RunResult resume(String runId, HumanDecision decision) throws RunNotFoundException {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        CancellationSignal signal = reserve(runId);
        try {
            RunSnapshot snapshot = load(runId);
            if (!snapshot.isSuspended()) {
                throw new IllegalStateException(
                        "Run " + runId + " is not waiting for a decision (phase " + snapshot.currentPhase() + ")");
            }
            ApprovalType pending = snapshot.pendingCheckpoint().approvalType();
            if (decision.approvalType() != pending) {
                throw new IllegalArgumentException(
                        "Run " + runId + " waits for " + pending + ", not " + decision.approvalType());
            }
            CheckpointDefinition definition = checkpointRegistry.get(pending);
            WorkflowState state = snapshot.state().apply(definition.resumeUpdate(snapshot.state(), decision));
            repository.save(RunSnapshot.resumed(runId, state, "resume:" + pending.id()));
            logger.info("Resumed run " + runId + " at " + pending + " with " + decision.fields().keySet());
            return drive(runId, state, signal);
        } finally {
            release(runId, signal);
        }
    }

    /// Rolls a run back to a checkpoint and continues it from there.
    ///
    /// The point is validated before anything is loaded. The run is claimed before its
    /// snapshot is read, so a rollback never rewrites a run another call is driving.
    ///
    /// @param runId run to rewind, not null
    /// @param pointId rollback point, one of {@link RollbackTable#pointIds()}
    /// @return the outcome of the continued drive, never null
    /// @throws InvalidRollbackPointException if `pointId` is not a rollback point
    /// @throws RunNotFoundException if no run with `runId` was persisted
    /// @throws IllegalStateException if the run is being driven by another call
    public RunResult rollback(String runId, String pointId) throws RunNotFoundException {
        RollbackPlan plan = RollbackTable.resolve(pointId);
        Objects.requireNonNull(runId, "runId must not be null");
        CancellationSignal signal = reserve(runId);
        try {
            RunSnapshot snapshot = load(runId);
            WorkflowState state = rollbackService.rollback(snapshot.state(), plan.point());
            repository.save(RunSnapshot.from(runId, state, "rollback:" + pointId));
            listener.onRolledBack(runId, pointId, state);
            return drive(runId, state, signal);
        } finally {
            release(runId, signal);
        }
    }

    /// Continues a persisted run, e.g. after a crash.
    ///
    /// A suspended run is not driven; its pending checkpoint is returned as is.
    ///
    /// @throws RunNotFoundException if no run with `runId` was persisted
    /// @throws IllegalStateException if the run is being driven by another call
    public RunResult advance(String runId) throws RunNotFoundException {
        Objects.requireNonNull(runId, "runId must not be null");
        CancellationSignal signal = reserve(runId);
        try {
            RunSnapshot snapshot = load(runId);
            if (snapshot.isSuspended()) {
                CheckpointPayload pending = snapshot.pendingCheckpoint();
                return new RunResult.Suspended(runId, pending.approvalType(), pending, snapshot.state());
            }
            return drive(runId, snapshot.state(), signal);
        } finally {
            release(runId, signal);
        }
    }

    /// Returns the latest snapshot of a run.
    public Optional<RunSnapshot> findRun(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return repository.findByRunId(runId);
    }

    /// Cancels the drive currently running for `runId`.
    ///
    /// Pending sub-steps resolve to a cancellation failure and the loop stops after the
    /// current step. The persisted state stays resumable through {@link #advance}.
    ///
    /// @return true if a drive was running
    public boolean cancel(String runId, String reason) {
        CancellationSignal signal = activeRuns.get(runId);
        if (signal == null) {
            return false;
        }
        signal.cancel(reason);
        return true;
    }

    private RunSnapshot load(String runId) throws RunNotFoundException {
        Objects.requireNonNull(runId, "runId must not be null");
        return repository.findByRunId(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    /// Claims `runId` for the calling thread until {@link #release} is called.
    private CancellationSignal reserve(String runId) {
        CancellationSignal signal = CancellationSignal.create();
        if (activeRuns.putIfAbsent(runId, signal) != null) {
            throw new IllegalStateException("Run " + runId + " is already being driven");
        }
        return signal;
    }

    private void release(String runId, CancellationSignal signal) {
        activeRuns.remove(runId, signal);
    }

    private RunResult drive(String runId, WorkflowState initial, CancellationSignal signal) {
        NodeContext context =
                NodeContext.builder()
                        .runId(runId)
                        .executorService(executorService)
                        .cancellationSignal(signal)
                        .config(config)
                        .listener(listener)
                        .services(services)
                        .build();
        return loop(runId, initial, context);
    }

    private RunResult loop(String runId, WorkflowState initial, NodeContext context) {
        WorkflowState state = initial;
        for (int steps = 0; ; steps++) {
            if (steps >= config.getMaxSteps()) {
                throw new IllegalStateException(
                        "Run "
                                + runId
                                + " exceeded "
                                + config.getMaxSteps()
                                + " steps in phase "
                                + state.get(ReportFields.CURRENT_PHASE));
            }
            if (context.getCancellationSignal().isCancelled()) {
                return cancelled(runId, state, context.getCancellationSignal().reason());
            }

            Step step = router.route(state);
            if (step.kind() == StepKind.TERMINAL) {
                return finish(runId, state, step);
            }
            if (step.kind() == StepKind.NODE) {
                state = runNode(runId, state, step, context);
                continue;
            }

            CheckpointDefinition definition = checkpointRegistry.get(step.approvalType());
            CheckpointOutcome outcome = definition.enter(state);
            if (outcome instanceof CheckpointOutcome.Suspended suspended) {
                state = state.apply(checkpointUpdate(state, step, true));
                return suspend(runId, state, suspended.payload());
            }
            state = state.apply(checkpointUpdate(state, step, false));
            repository.save(RunSnapshot.from(runId, state, "skip:" + step.id()));
        }
    }

    private WorkflowState runNode(String runId, WorkflowState state, Step step, NodeContext context) {
        PipelineNode node = nodeRegistry.getNode(step);
        listener.onStepStart(runId, step);

        StateUpdate update;
        try {
            update = node.execute(state, context);
        } catch (StateContractException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.getCancellationSignal().cancel(step + " interrupted");
            return state;
        } catch (Exception e) {
            return recordFailure(runId, state, step, e);
        }

        Objects.requireNonNull(update, () -> step + " returned a null update");
        StateUpdate.Builder merged = StateUpdate.builder().include(update);
        if (!update.touches(ReportFields.CURRENT_PHASE)) {
            merged.set(ReportFields.CURRENT_PHASE, step.phase());
        }
        if (consumesOverride(state, step) && !update.touches(ReportFields.NEXT_STEP_OVERRIDE)) {
            merged.clear(ReportFields.NEXT_STEP_OVERRIDE);
        }
        WorkflowState next = state.apply(merged.build());
        repository.save(RunSnapshot.from(runId, next, "step:" + step.id()));
        listener.onStepComplete(runId, step, next);
        return next;
    }

    private WorkflowState recordFailure(String runId, WorkflowState state, Step step, Exception e) {
        Phase lastGood = state.get(ReportFields.CURRENT_PHASE);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        ErrorRecord error = ErrorRecord.of(step.id() + "-failed", message, step.phase(), step.id());
        logger.log(Level.WARNING, "Run " + runId + ": step " + step + " failed", e);

        StateUpdate.Builder update = StateUpdate.builder().set(ReportFields.ERRORS, List.of(error));
        if (consumesOverride(state, step)) {
            update.clear(ReportFields.NEXT_STEP_OVERRIDE);
        }
        ArtifactKind kind = step.artifactKind();
        if (kind != null && step != kind.gateStep()) {
            Evaluation failure =
                    Evaluation.structuralFailure(
                            List.of(step.id() + " failed: " + message),
                            "Retry " + kind + " generation; the previous attempt did not complete.");
            update.set(
                            ReportFields.EVALUATION_HISTORY,
                            new EvaluationRecord(
                                    kind,
                                    kind.revisionCount(state),
                                    state.get(ReportFields.ROLLBACK_EPOCH),
                                    failure,
                                    Instant.now()))
                    .set(ReportFields.CURRENT_PHASE, step.phase());
        } else {
            update.set(ReportFields.LAST_GOOD_PHASE, lastGood).set(ReportFields.CURRENT_PHASE, Phase.ERROR);
        }

        WorkflowState next = state.apply(update.build());
        repository.save(RunSnapshot.from(runId, next, "failed:" + step.id()));
        listener.onStepFailed(runId, step, error);
        return next;
    }

    private StateUpdate checkpointUpdate(WorkflowState state, Step step, boolean suspending) {
        StateUpdate.Builder update = StateUpdate.builder();
        if (suspending) {
            update.set(ReportFields.AWAITING_APPROVAL, Boolean.TRUE)
                    .set(ReportFields.APPROVAL_TYPE, step.approvalType())
                    .set(ReportFields.CURRENT_PHASE, step.phase());
        } else if (state.get(ReportFields.AWAITING_APPROVAL)) {
            update.set(ReportFields.AWAITING_APPROVAL, Boolean.FALSE).clear(ReportFields.APPROVAL_TYPE);
        }
        if (consumesOverride(state, step)) {
            update.clear(ReportFields.NEXT_STEP_OVERRIDE);
        }
        return update.build();
    }

    private RunResult suspend(String runId, WorkflowState state, CheckpointPayload payload) {
        repository.save(RunSnapshot.suspended(runId, state, payload, "checkpoint:" + payload.approvalType().id()));
        listener.onSuspended(runId, payload);
        logger.info("Run " + runId + " suspended at " + payload.approvalType());
        return new RunResult.Suspended(runId, payload.approvalType(), payload, state);
    }

    private RunResult finish(String runId, WorkflowState state, Step step) {
        if (step == Step.HALT) {
            List<ErrorRecord> errors = state.get(ReportFields.ERRORS);
            ErrorRecord last = errors.isEmpty() ? null : errors.get(errors.size() - 1);
            repository.save(RunSnapshot.from(runId, state, "halted"));
            listener.onFinished(runId, state);
            logger.warning("Run " + runId + " halted" + (last != null ? ": " + last.message() : ""));
            return new RunResult.Failed(state, last);
        }
        WorkflowState completed = state;
        if (state.get(ReportFields.CURRENT_PHASE) != Phase.COMPLETE) {
            completed = state.apply(StateUpdate.builder().set(ReportFields.CURRENT_PHASE, Phase.COMPLETE).build());
        }
        repository.save(RunSnapshot.from(runId, completed, "completed"));
        listener.onFinished(runId, completed);
        logger.info("Run " + runId + " completed");
        return new RunResult.Completed(completed);
    }

    private RunResult cancelled(String runId, WorkflowState state, String reason) {
        ErrorRecord error =
                ErrorRecord.of("cancelled", reason, state.get(ReportFields.CURRENT_PHASE), null);
        WorkflowState next =
                state.apply(StateUpdate.builder().set(ReportFields.ERRORS, List.of(error)).build());
        repository.save(RunSnapshot.from(runId, next, "cancelled"));
        logger.info("Run " + runId + " cancelled: " + reason);
        return new RunResult.Failed(next, error);
    }

    private static boolean consumesOverride(WorkflowState state, Step step) {
        return state.get(ReportFields.NEXT_STEP_OVERRIDE) == step && !state.get(ReportFields.AWAITING_APPROVAL);
    }

    /// Builder for {@link PipelineEngine}.
    ///
    /// Required: `nodeRegistry`, `checkpointRegistry`, `repository`, `executorService`.
    /// The schema defaults to {@link ReportFields#SCHEMA}, the router to
    /// {@link ReportRouter}.
    public static final class Builder {
        private StateSchema schema = ReportFields.SCHEMA;
        private PhaseRouter router = new ReportRouter();
        private NodeRegistry nodeRegistry;
        private CheckpointRegistry checkpointRegistry;
        private RunStateRepository repository;
        private RollbackService rollbackService = new RollbackService();
        private ExecutorService executorService;
        private EngineConfig config = EngineConfig.defaults();
        private PipelineListener listener = PipelineListener.NOOP;
        private final Map<Class<?>, Object> services = new HashMap<>();

        private Builder() {}

        public Builder schema(StateSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder router(PhaseRouter router) {
            this.router = router;
            return this;
        }

        public Builder nodeRegistry(NodeRegistry nodeRegistry) {
            this.nodeRegistry = nodeRegistry;
            return this;
        }

        public Builder checkpointRegistry(CheckpointRegistry checkpointRegistry) {
            this.checkpointRegistry = checkpointRegistry;
            return this;
        }

        public Builder repository(RunStateRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder rollbackService(RollbackService rollbackService) {
            this.rollbackService = rollbackService;
            return this;
        }

        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
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

        /// Registers a collaborator nodes look up through {@link NodeContext#service}.
        public <T> Builder service(Class<T> type, T service) {
            services.put(
                    Objects.requireNonNull(type, "type must not be null"),
                    Objects.requireNonNull(service, "service must not be null"));
            return this;
        }

        public PipelineEngine build() {
            Objects.requireNonNull(schema, "schema must not be null");
            Objects.requireNonNull(router, "router must not be null");
            Objects.requireNonNull(nodeRegistry, "nodeRegistry must not be null");
            Objects.requireNonNull(checkpointRegistry, "checkpointRegistry must not be null");
            Objects.requireNonNull(repository, "repository must not be null");
            Objects.requireNonNull(rollbackService, "rollbackService must not be null");
            Objects.requireNonNull(executorService, "executorService must not be null");
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(listener, "listener must not be null");
            return new PipelineEngine(this);
        }
    }
}
