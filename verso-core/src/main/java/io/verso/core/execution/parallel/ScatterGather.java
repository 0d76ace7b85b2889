package io.verso.core.execution.parallel;

import io.verso.core.execution.NodeContext;
import io.verso.core.state.WorkflowState;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Runs independent sub-steps of one node concurrently and waits for all of them.
///
/// Every sub-step sees the same immutable state. Each one resolves to exactly one
/// {@link SubStepResult}: a failure, timeout or cancellation of one sub-step never
/// prevents the others from completing.
///
/// ### Contracts
/// - **Postcondition**: the result has one entry per sub-step, in submission order
/// - **Postcondition**: returns only after every sub-step has resolved
///
/// @implNote Stateless and thread-safe. A timed-out sub-step keeps running on its pool
/// thread; its late result is discarded.
public final class ScatterGather {

    private static final Logger logger = Logger.getLogger(ScatterGather.class.getName());

    private ScatterGather() {}

    /// Runs `subSteps` on the context's executor with the configured sub-step timeout.
    ///
    /// @param subSteps named sub-steps, not null
    /// @param state shared snapshot, not null
    /// @param context node context providing the executor, timeout and cancellation
    /// @return results keyed by sub-step name, never null
    public static <T> Map<String, SubStepResult<T>> gather(
            Map<String, SubStep<T>> subSteps, WorkflowState state, NodeContext context) {
        Duration timeout = context.getConfig().getSubStepTimeout();
        Map<String, CompletableFuture<SubStepResult<T>>> futures = new LinkedHashMap<>();

        for (Map.Entry<String, SubStep<T>> entry : subSteps.entrySet()) {
            String name = entry.getKey();
            SubStep<T> subStep = entry.getValue();
            CompletableFuture<SubStepResult<T>> future =
                    CompletableFuture.supplyAsync(() -> run(name, subStep, state), context.getExecutorService())
                            .exceptionally(
                                    error -> SubStepResult.failed(FailureReason.ERROR, describe(error)))
                            .completeOnTimeout(
                                    SubStepResult.failed(
                                            FailureReason.TIMEOUT,
                                            name + " timed out after " + timeout.toMillis() + "ms"),
                                    timeout.toMillis(),
                                    TimeUnit.MILLISECONDS);
            context.getCancellationSignal()
                    .onCancel(reason -> future.complete(SubStepResult.failed(FailureReason.CANCELLED, reason)));
            futures.put(name, future);
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.values()
                    .forEach(
                            future ->
                                    future.complete(
                                            SubStepResult.failed(
                                                    FailureReason.CANCELLED, "interrupted")));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sub-step future failed unexpectedly", e.getCause());
        }

        Map<String, SubStepResult<T>> results = new LinkedHashMap<>();
        futures.forEach(
                (name, future) -> {
                    SubStepResult<T> result = future.join();
                    if (result instanceof SubStepResult.Failed<T> failed) {
                        logger.warning("Sub-step " + name + " failed (" + failed.reason() + "): " + failed.message());
                        context.getListener().onSubStepFailed(context.getRunId(), name, failed.message());
                    }
                    results.put(name, result);
                });
        return Collections.unmodifiableMap(results);
    }

    private static <T> SubStepResult<T> run(String name, SubStep<T> subStep, WorkflowState state) {
        try {
            return SubStepResult.succeeded(subStep.run(state));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SubStepResult.failed(FailureReason.CANCELLED, name + " interrupted");
        } catch (Exception e) {
            return SubStepResult.failed(FailureReason.ERROR, describe(e));
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error.getCause() != null && error.getMessage() == null ? error.getCause() : error;
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
