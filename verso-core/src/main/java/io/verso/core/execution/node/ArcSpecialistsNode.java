package io.verso.core.execution.node;

import io.verso.core.execution.NodeContext;
import io.verso.core.execution.parallel.ScatterGather;
import io.verso.core.execution.parallel.SubStep;
import io.verso.core.execution.parallel.SubStepResult;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.routing.ReportConditions;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Runs the specialist analyses that are still missing in parallel and merges them into
/// `specialistAnalyses`.
///
/// A failed domain is stored as `{"_error": message}` so arc synthesis can proceed with
/// the analyses that succeeded.
public final class ArcSpecialistsNode implements PipelineNode {

    /// Key of the marker stored for a failed domain.
    public static final String ERROR_MARKER = "_error";

    private static final Logger logger = Logger.getLogger(ArcSpecialistsNode.class.getName());

    @Override
    public Step getStep() {
        return Step.ARC_SPECIALISTS;
    }

    @Override
    public StateUpdate execute(WorkflowState state, NodeContext context) {
        SpecialistAnalyzer analyzer = context.service(SpecialistAnalyzer.class);
        Map<String, Object> existing = state.get(ReportFields.SPECIALIST_ANALYSES);

        Map<String, SubStep<Map<String, Object>>> subSteps = new LinkedHashMap<>();
        for (String domain : ReportConditions.SPECIALIST_DOMAINS) {
            if (!ReportConditions.isPresent(existing.get(domain))) {
                subSteps.put(domain, snapshot -> analyzer.analyze(domain, snapshot));
            }
        }

        Map<String, Object> analyses = new LinkedHashMap<>();
        ScatterGather.gather(subSteps, state, context)
                .forEach(
                        (domain, result) -> {
                            if (result instanceof SubStepResult.Succeeded<Map<String, Object>> succeeded
                                    && ReportConditions.isPresent(succeeded.value())) {
                                analyses.put(domain, succeeded.value());
                            } else {
                                analyses.put(domain, Map.of(ERROR_MARKER, describe(result)));
                            }
                        });
        logger.info("Specialist analyses merged: " + analyses.keySet());

        return StateUpdate.builder()
                .set(ReportFields.SPECIALIST_ANALYSES, analyses)
                .set(ReportFields.CURRENT_PHASE, Phase.ARC_SPECIALISTS)
                .build();
    }

    private static String describe(SubStepResult<Map<String, Object>> result) {
        if (result instanceof SubStepResult.Failed<Map<String, Object>> failed) {
            return failed.reason() + ": " + failed.message();
        }
        return "empty analysis";
    }
}
