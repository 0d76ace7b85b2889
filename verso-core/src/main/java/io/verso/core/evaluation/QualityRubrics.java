package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.util.EnumMap;
import java.util.Map;

/// Built-in rubrics for the three revisable artifacts.
public final class QualityRubrics {

    private QualityRubrics() {}

    public static final QualityRubric ARCS =
            QualityRubric.builder(ArtifactKind.ARCS)
                    .structural("rosterCoverage", 0.30, "Every roster member is placed in at least one arc")
                    .structural("evidenceIdValidity", 0.25, "Every key evidence id exists in the evidence bundle")
                    .structural("accusationArcPresent", 0.20, "One arc addresses the players' accusation")
                    .advisory("coherence", 0.15, "Arcs tell a consistent story without contradictions")
                    .advisory("evidenceConfidenceBalance", 0.10, "Some arcs rest on strong or moderate evidence")
                    .build();

    public static final QualityRubric OUTLINE =
            QualityRubric.builder(ArtifactKind.OUTLINE)
                    .structural("arcCoverage", 0.20, "The outline addresses every selected arc")
                    .structural("requiredSections", 0.20, "Lede, story, players and closing sections are present")
                    .structural("arcSectionFlow", 0.20, "Arcs run through several sections instead of one")
                    .structural("visualDistributionPlan", 0.10, "Visuals are budgeted across sections")
                    .advisory("sectionBalance", 0.05, "Sections are weighted sensibly")
                    .advisory("flowLogic", 0.05, "The narrative order makes sense")
                    .advisory("photoPlacement", 0.05, "Photos are placed where they add meaning")
                    .advisory("wordBudget", 0.05, "Section word budgets fit the target length")
                    .advisory("loopArchitecture", 0.025, "Open questions raised early are closed later")
                    .advisory("arcInterweaving", 0.025, "Arcs reference each other where they meet")
                    .advisory("visualMomentum", 0.025, "Visual pacing avoids long text-only stretches")
                    .advisory("convergence", 0.025, "Threads converge toward the closing")
                    .build();

    public static final QualityRubric ARTICLE =
            QualityRubric.builder(ArtifactKind.ARTICLE)
                    .structural("voiceConsistency", 0.20, "The journalist voice holds throughout")
                    .structural("antiPatterns", 0.15, "No banned phrasing or game-mechanic language")
                    .structural("visualDistribution", 0.15, "Visual components are spread across the article")
                    .structural("arcThreading", 0.10, "Selected arcs are threaded through the sections")
                    .advisory("evidenceIntegration", 0.15, "Evidence is quoted and woven into the prose")
                    .advisory("characterPlacement", 0.10, "Characters appear where their evidence does")
                    .advisory("emotionalResonance", 0.15, "The piece lands emotionally")
                    .build();

    /// Returns the built-in rubric of every kind.
    public static Map<ArtifactKind, QualityRubric> defaults() {
        Map<ArtifactKind, QualityRubric> rubrics = new EnumMap<>(ArtifactKind.class);
        rubrics.put(ArtifactKind.ARCS, ARCS);
        rubrics.put(ArtifactKind.OUTLINE, OUTLINE);
        rubrics.put(ArtifactKind.ARTICLE, ARTICLE);
        return rubrics;
    }
}
