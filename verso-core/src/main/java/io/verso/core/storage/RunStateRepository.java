package io.verso.core.storage;

import java.util.List;
import java.util.Optional;

/// Repository for run snapshots.
///
/// Saving a snapshot for an existing run id replaces the previous one; only the latest
/// snapshot of each run is kept.
///
/// @see InMemoryRunStateRepository for the default implementation
public interface RunStateRepository {

    /// Saves or replaces the snapshot of `snapshot.runId()`.
    ///
    /// @param snapshot the state to persist, not null
    void save(RunSnapshot snapshot);

    /// @param runId run identifier, not null
    /// @return the latest snapshot, empty if the run is unknown
    Optional<RunSnapshot> findByRunId(String runId);

    /// Returns every run currently waiting for a reviewer.
    ///
    /// @return suspended snapshots, never null
    List<RunSnapshot> findSuspended();

    /// @return true if a snapshot was deleted
    boolean delete(String runId);
}
