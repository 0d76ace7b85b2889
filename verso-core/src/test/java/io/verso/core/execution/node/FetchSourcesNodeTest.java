package io.verso.core.execution.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.verso.core.execution.NodeContext;
import io.verso.core.execution.node.SourceFetcher.Source;
import io.verso.core.pipeline.ErrorRecord;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.ReportStates;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.io.IOException;
import java.util.List;
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

@DisplayName("FetchSourcesNode")
@ExtendWith(MockitoExtension.class)
class FetchSourcesNodeTest {

    @Mock private SourceFetcher fetcher;

    private ExecutorService executor;
    private NodeContext context;
    private final FetchSourcesNode node = new FetchSourcesNode();
    private final WorkflowState parsed =
            ReportStates.withFullContext()
                    .apply(
                            StateUpdate.builder()
                                    .set(ReportFields.SESSION_CONFIG, Map.of("title", "Manor"))
                                    .set(ReportFields.INPUT_APPROVED, true)
                                    .build());

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        context =
                NodeContext.builder()
                        .runId("run-1")
                        .executorService(executor)
                        .service(SourceFetcher.class, fetcher)
                        .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldStoreEverySource() throws Exception {
        when(fetcher.fetch(eq(Source.MEMORY_TOKENS), any())).thenReturn(List.of(Map.of("id", "t1")));
        when(fetcher.fetch(eq(Source.PAPER_EVIDENCE), any())).thenReturn(List.of(Map.of("id", "p1")));
        when(fetcher.fetch(eq(Source.SESSION_PHOTOS), any())).thenReturn(List.of("photo.jpg"));

        WorkflowState next = parsed.apply(node.execute(parsed, context));

        assertThat(next.get(ReportFields.MEMORY_TOKENS)).containsExactly(Map.of("id", "t1"));
        assertThat(next.get(ReportFields.PAPER_EVIDENCE)).containsExactly(Map.of("id", "p1"));
        assertThat(next.get(ReportFields.SESSION_PHOTOS)).containsExactly("photo.jpg");
        assertThat(next.get(ReportFields.ERRORS)).isEmpty();
    }

    @Test
    @DisplayName("a failed source becomes an empty list plus a fetch-failed error")
    void shouldDegradeFailedSource() throws Exception {
        when(fetcher.fetch(eq(Source.MEMORY_TOKENS), any())).thenReturn(List.of(Map.of("id", "t1")));
        when(fetcher.fetch(eq(Source.PAPER_EVIDENCE), any())).thenThrow(new IOException("notion unavailable"));
        when(fetcher.fetch(eq(Source.SESSION_PHOTOS), any())).thenReturn(List.of());

        WorkflowState next = parsed.apply(node.execute(parsed, context));

        assertThat(next.get(ReportFields.PAPER_EVIDENCE)).isEmpty();
        assertThat(next.get(ReportFields.ERRORS))
                .singleElement()
                .satisfies(
                        error -> {
                            assertThat(error.kind()).isEqualTo(FetchSourcesNode.FETCH_FAILED);
                            assertThat(error.message()).isEqualTo("paperEvidence ERROR: notion unavailable");
                            assertThat(error.step()).isEqualTo("fetchSources");
                        });
    }

    @Test
    void shouldSkipSourcesAlreadyFetched() throws Exception {
        WorkflowState state =
                parsed.apply(
                        StateUpdate.builder()
                                .set(ReportFields.MEMORY_TOKENS, List.of())
                                .set(ReportFields.PAPER_EVIDENCE, List.of())
                                .build());
        when(fetcher.fetch(eq(Source.SESSION_PHOTOS), any())).thenReturn(List.of("photo.jpg"));

        WorkflowState next = state.apply(node.execute(state, context));

        verify(fetcher, never()).fetch(eq(Source.MEMORY_TOKENS), any());
        assertThat(next.get(ReportFields.SESSION_PHOTOS)).containsExactly("photo.jpg");
        assertThat(next.get(ReportFields.ERRORS)).extracting(ErrorRecord::kind).isEmpty();
    }
}
