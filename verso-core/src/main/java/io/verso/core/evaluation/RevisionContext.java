package io.verso.core.evaluation;

import java.util.Objects;

/// Instructions handed to a regeneration step.
///
/// @param contextBlock prioritised revision instructions, not null
/// @param priorOutputBlock the previous output for reference, not null
public record RevisionContext(String contextBlock, String priorOutputBlock) {

    public RevisionContext {
        Objects.requireNonNull(contextBlock, "contextBlock must not be null");
        Objects.requireNonNull(priorOutputBlock, "priorOutputBlock must not be null");
    }
}
