package io.verso.core.execution;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/// One-shot cancellation flag shared between the caller and the sub-steps of a run.
///
/// @implNote Thread-safe. Cancelling twice keeps the first reason.
public final class CancellationSignal {

    private final CompletableFuture<String> cancelled = new CompletableFuture<>();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /// Signals cancellation; callbacks registered through {@link #onCancel} run on the
    /// calling thread.
    public void cancel(String reason) {
        cancelled.complete(reason != null ? reason : "cancelled");
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /// Returns the reason passed to {@link #cancel}, or null while not cancelled.
    public String reason() {
        return cancelled.getNow(null);
    }

    /// Registers a callback receiving the cancellation reason. Runs immediately when the
    /// signal is already cancelled.
    public void onCancel(Consumer<String> callback) {
        cancelled.thenAccept(callback);
    }
}
