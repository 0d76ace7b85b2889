package io.verso.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.verso.core.storage.RunSnapshot;
import io.verso.core.storage.RunStateRepository;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// Run state repository storing one `<runId>.json` document per run in a directory.
///
/// Writes go to a temporary file first and are moved over the previous document, so a
/// crash mid-write leaves the last complete snapshot in place.
///
/// ### Contracts
/// - **Precondition**: run ids consist of letters, digits, `.`, `_` and `-`
/// - **Postcondition**: after {@link #save} returns, {@link #findByRunId} sees the snapshot
///
/// @implNote Thread-safe for distinct runs. Concurrent saves of the same run are
/// last-writer-wins.
public final class FileRunStateRepository implements RunStateRepository {

    private static final Logger logger = Logger.getLogger(FileRunStateRepository.class.getName());
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper = RunSnapshotSerializer.createMapper();

    /// @param directory storage directory, created if missing
    /// @throws RunStatePersistenceException if the directory cannot be created
    public FileRunStateRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RunStatePersistenceException("Cannot create run state directory " + directory, e);
        }
    }

    @Override
    public void save(RunSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path target = pathFor(snapshot.runId());
        try {
            Path temp = Files.createTempFile(directory, snapshot.runId(), ".tmp");
            mapper.writeValue(temp.toFile(), snapshot);
            move(temp, target);
        } catch (IOException e) {
            throw new RunStatePersistenceException("Cannot write snapshot of run " + snapshot.runId(), e);
        }
    }

    @Override
    public Optional<RunSnapshot> findByRunId(String runId) {
        Path path = pathFor(runId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    @Override
    public List<RunSnapshot> findSuspended() {
        List<RunSnapshot> suspended = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList()) {
                RunSnapshot snapshot = read(path);
                if (snapshot.isSuspended()) {
                    suspended.add(snapshot);
                }
            }
        } catch (IOException e) {
            throw new RunStatePersistenceException("Cannot list run state directory " + directory, e);
        }
        return suspended;
    }

    @Override
    public boolean delete(String runId) {
        try {
            return Files.deleteIfExists(pathFor(runId));
        } catch (IOException e) {
            throw new RunStatePersistenceException("Cannot delete snapshot of run " + runId, e);
        }
    }

    private RunSnapshot read(Path path) {
        try {
            return mapper.readValue(path.toFile(), RunSnapshot.class);
        } catch (IOException e) {
            throw new RunStatePersistenceException("Cannot read snapshot " + path, e);
        }
    }

    private void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported in " + directory + ", falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path pathFor(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        if (!RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Run id not usable as a file name: " + runId);
        }
        return directory.resolve(runId + SUFFIX);
    }
}
