package io.verso.core.execution.node;

import io.verso.core.execution.NodeContext;
import io.verso.core.execution.node.SourceFetcher.Source;
import io.verso.core.execution.parallel.ScatterGather;
import io.verso.core.execution.parallel.SubStep;
import io.verso.core.execution.parallel.SubStepResult;
import io.verso.core.pipeline.ErrorRecord;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Fetches the sources that have not been fetched yet in parallel.
///
/// A failed source is stored as an empty list and logged as a `fetch-failed` error, so
/// the run proceeds with whatever could be retrieved.
public final class FetchSourcesNode implements PipelineNode {

    static final String FETCH_FAILED = "fetch-failed";

    @Override
    public Step getStep() {
        return Step.FETCH_SOURCES;
    }

    @Override
    public StateUpdate execute(WorkflowState state, NodeContext context) {
        SourceFetcher fetcher = context.service(SourceFetcher.class);

        Map<String, SubStep<List<Object>>> subSteps = new LinkedHashMap<>();
        Map<String, Source> byName = new LinkedHashMap<>();
        for (Source source : Source.values()) {
            if (state.get(source.field()) == null) {
                byName.put(source.field().name(), source);
                subSteps.put(source.field().name(), snapshot -> fetcher.fetch(source, snapshot));
            }
        }

        StateUpdate.Builder update = StateUpdate.builder();
        List<ErrorRecord> errors = new ArrayList<>();
        ScatterGather.gather(subSteps, state, context)
                .forEach(
                        (name, result) -> {
                            Source source = byName.get(name);
                            if (result instanceof SubStepResult.Succeeded<List<Object>> succeeded) {
                                List<Object> items = succeeded.value();
                                update.set(source.field(), items != null ? items : List.of());
                            } else {
                                SubStepResult.Failed<List<Object>> failed =
                                        (SubStepResult.Failed<List<Object>>) result;
                                update.set(source.field(), List.of());
                                errors.add(
                                        ErrorRecord.of(
                                                FETCH_FAILED,
                                                name + " " + failed.reason() + ": " + failed.message(),
                                                Phase.FETCH_SOURCES,
                                                getStep().id()));
                            }
                        });
        if (!errors.isEmpty()) {
            update.set(ReportFields.ERRORS, errors);
        }
        return update.set(ReportFields.CURRENT_PHASE, Phase.FETCH_SOURCES).build();
    }
}
