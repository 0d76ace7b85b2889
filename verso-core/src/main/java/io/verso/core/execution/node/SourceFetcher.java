package io.verso.core.execution.node;

import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.StateField;
import io.verso.core.state.WorkflowState;
import java.util.List;

/// Fetches one external source of a session.
@FunctionalInterface
public interface SourceFetcher {

    /// Sources fetched in parallel by {@link FetchSourcesNode}.
    enum Source {
        MEMORY_TOKENS(ReportFields.MEMORY_TOKENS),
        PAPER_EVIDENCE(ReportFields.PAPER_EVIDENCE),
        SESSION_PHOTOS(ReportFields.SESSION_PHOTOS);

        private final StateField<List<Object>, List<Object>> field;

        Source(StateField<List<Object>, List<Object>> field) {
            this.field = field;
        }

        public StateField<List<Object>, List<Object>> field() {
            return field;
        }
    }

    /// @param source source to fetch, not null
    /// @param state shared run state, not null
    /// @return fetched items, may be empty
    /// @throws Exception if the source is unavailable
    List<Object> fetch(Source source, WorkflowState state) throws Exception;
}
