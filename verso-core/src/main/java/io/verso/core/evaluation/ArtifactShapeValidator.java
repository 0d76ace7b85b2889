package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Checks that a generated artifact has the shape downstream steps rely on.
///
/// A non-empty result is a structural evaluation failure; it never raises.
@FunctionalInterface
public interface ArtifactShapeValidator {

    /// @param kind artifact kind, not null
    /// @param artifact current artifact, null when absent
    /// @return violations, empty when the artifact is well-formed
    List<String> validate(ArtifactKind kind, Object artifact);

    /// Accepts anything that is present.
    ArtifactShapeValidator PRESENCE_ONLY =
            (kind, artifact) ->
                    artifact == null ? List.of(kind.id() + " artifact is missing") : List.of();

    /// Minimal shapes of the report artifacts: arcs are a list of objects with a
    /// `title`, the outline is an object, the article bundle has a `headline` and a
    /// non-empty `sections` list.
    static ArtifactShapeValidator reportShapes() {
        return (kind, artifact) -> {
            List<String> violations = new ArrayList<>(PRESENCE_ONLY.validate(kind, artifact));
            if (!violations.isEmpty()) {
                return violations;
            }
            switch (kind) {
                case ARCS -> {
                    if (!(artifact instanceof List<?> arcs)) {
                        violations.add("arcs must be a list");
                    } else {
                        for (int i = 0; i < arcs.size(); i++) {
                            if (!(arcs.get(i) instanceof Map<?, ?> arc) || arc.get("title") == null) {
                                violations.add("arc " + i + " has no title");
                            }
                        }
                    }
                }
                case OUTLINE -> {
                    if (!(artifact instanceof Map<?, ?>)) {
                        violations.add("outline must be an object");
                    }
                }
                case ARTICLE -> {
                    if (!(artifact instanceof Map<?, ?> bundle)) {
                        violations.add("content bundle must be an object");
                    } else {
                        if (bundle.get("headline") == null) {
                            violations.add("content bundle has no headline");
                        }
                        if (!(bundle.get("sections") instanceof List<?> sections) || sections.isEmpty()) {
                            violations.add("content bundle has no sections");
                        }
                    }
                }
            }
            return violations;
        };
    }
}
