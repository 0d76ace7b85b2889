package io.verso.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verso.core.checkpoint.CheckpointPayload;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.storage.RunSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileRunStateRepositoryTest {

    @TempDir Path directory;

    private FileRunStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileRunStateRepository(directory.resolve("runs"));
    }

    private static RunSnapshot suspended(String runId) {
        return RunSnapshot.suspended(
                runId,
                RunSnapshotSerializerTest.outlineUnderReview(),
                new CheckpointPayload(ApprovalType.OUTLINE, Phase.OUTLINE_CHECKPOINT, Map.of("revisionCount", 2)),
                "checkpoint:outline");
    }

    @Test
    void save_thenFindByRunId() {
        RunSnapshot snapshot = suspended("run-1");

        repository.save(snapshot);

        assertThat(repository.findByRunId("run-1")).contains(snapshot);
        assertThat(directory.resolve("runs").resolve("run-1.json")).exists();
    }

    @Test
    void save_replacesPreviousSnapshotWithoutLeftovers() throws IOException {
        repository.save(suspended("run-1"));
        RunSnapshot later =
                RunSnapshot.from("run-1", ReportFields.SCHEMA.defaultState(), "rollback:outline");

        repository.save(later);

        assertThat(repository.findByRunId("run-1").orElseThrow().reason()).isEqualTo("rollback:outline");
        try (Stream<Path> files = Files.list(directory.resolve("runs"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("run-1.json");
        }
    }

    @Test
    void findByRunId_unknownRun() {
        assertThat(repository.findByRunId("run-404")).isEmpty();
    }

    @Test
    void findSuspended_skipsRunsWithoutPendingCheckpoint() {
        repository.save(suspended("run-1"));
        repository.save(RunSnapshot.from("run-2", ReportFields.SCHEMA.defaultState(), "start"));

        assertThat(repository.findSuspended()).extracting(RunSnapshot::runId).containsExactly("run-1");
    }

    @Test
    void delete_removesDocument() {
        repository.save(suspended("run-1"));

        assertThat(repository.delete("run-1")).isTrue();
        assertThat(repository.delete("run-1")).isFalse();
        assertThat(repository.findByRunId("run-1")).isEmpty();
    }

    @Test
    void rejectsRunIdUnusableAsFileName() {
        assertThatThrownBy(() -> repository.findByRunId("../escape"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("../escape");
    }

    @Test
    void findByRunId_corruptDocument() throws IOException {
        Files.writeString(directory.resolve("runs").resolve("run-1.json"), "{ not json");

        assertThatThrownBy(() -> repository.findByRunId("run-1"))
                .isInstanceOf(RunStatePersistenceException.class)
                .hasMessageContaining("run-1.json");
    }
}
