package io.verso.core.execution.node;

import io.verso.core.state.WorkflowState;
import java.util.Map;

/// Produces the analysis of one specialist domain (financial, behavioral,
/// victimization) from the curated evidence.
@FunctionalInterface
public interface SpecialistAnalyzer {

    /// @param domain domain to analyse, one of
    ///     {@link io.verso.core.routing.ReportConditions#SPECIALIST_DOMAINS}
    /// @param state shared run state, not null
    /// @return the analysis, not empty
    /// @throws Exception if the analysis cannot be produced
    Map<String, Object> analyze(String domain, WorkflowState state) throws Exception;
}
