package io.verso.core.execution.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.verso.core.execution.NodeContext;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.ReportStates;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("ArcSpecialistsNode")
@ExtendWith(MockitoExtension.class)
class ArcSpecialistsNodeTest {

    @Mock private SpecialistAnalyzer analyzer;

    private ExecutorService executor;
    private NodeContext context;
    private final ArcSpecialistsNode node = new ArcSpecialistsNode();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        context =
                NodeContext.builder()
                        .runId("run-1")
                        .executorService(executor)
                        .service(SpecialistAnalyzer.class, analyzer)
                        .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldMergeEveryDomain() throws Exception {
        when(analyzer.analyze(any(), any()))
                .thenAnswer(invocation -> Map.of("summary", invocation.getArgument(0) + " findings"));

        WorkflowState state = ReportStates.evidenceApproved();

        WorkflowState next = state.apply(node.execute(state, context));

        assertThat(next.get(ReportFields.SPECIALIST_ANALYSES))
                .containsOnlyKeys("financial", "behavioral", "victimization")
                .containsEntry("financial", Map.of("summary", "financial findings"));
        assertThat(next.get(ReportFields.CURRENT_PHASE)).isEqualTo(Phase.ARC_SPECIALISTS);
    }

    @Test
    @DisplayName("a failed domain is stored as an error marker")
    void shouldMarkFailedDomain() throws Exception {
        when(analyzer.analyze(eq("financial"), any())).thenReturn(Map.of("summary", "debts"));
        when(analyzer.analyze(eq("behavioral"), any())).thenThrow(new IllegalStateException("model overloaded"));
        when(analyzer.analyze(eq("victimization"), any())).thenReturn(Map.of());

        Map<String, Object> analyses =
                node.execute(ReportStates.evidenceApproved(), context).valueOf(ReportFields.SPECIALIST_ANALYSES);

        assertThat(analyses.get("financial")).isEqualTo(Map.of("summary", "debts"));
        assertThat(analyses.get("behavioral"))
                .isEqualTo(Map.of(ArcSpecialistsNode.ERROR_MARKER, "ERROR: model overloaded"));
        assertThat(analyses.get("victimization"))
                .isEqualTo(Map.of(ArcSpecialistsNode.ERROR_MARKER, "empty analysis"));
    }

    @Test
    void shouldOnlyRunMissingDomains() throws Exception {
        WorkflowState state =
                ReportStates.evidenceApproved()
                        .apply(
                                StateUpdate.builder()
                                        .set(
                                                ReportFields.SPECIALIST_ANALYSES,
                                                Map.of(
                                                        "financial", Map.of("summary", "kept"),
                                                        "behavioral", Map.of("summary", "kept")))
                                        .build());
        when(analyzer.analyze(eq("victimization"), any())).thenReturn(Map.of("summary", "new"));

        WorkflowState next = state.apply(node.execute(state, context));

        verify(analyzer, never()).analyze(eq("financial"), any());
        verify(analyzer, never()).analyze(eq("behavioral"), any());
        assertThat(next.get(ReportFields.SPECIALIST_ANALYSES))
                .containsEntry("financial", Map.of("summary", "kept"))
                .containsEntry("victimization", Map.of("summary", "new"));
    }
}
