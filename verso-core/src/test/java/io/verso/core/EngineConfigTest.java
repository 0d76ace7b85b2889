package io.verso.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verso.core.evaluation.QualityRubric;
import io.verso.core.pipeline.ArtifactKind;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EngineConfig")
class EngineConfigTest {

    @Test
    void shouldUseDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getThreadPoolSize()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.getSubStepTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getMaxSteps()).isEqualTo(500);
        assertThat(config.getStructuralThreshold()).isEqualTo(QualityRubric.DEFAULT_THRESHOLD);
        assertThat(config.getRevisionCaps()).isEmpty();
        for (ArtifactKind kind : ArtifactKind.values()) {
            assertThat(config.getRevisionCap(kind)).isEqualTo(kind.defaultCap());
        }
    }

    @Test
    void shouldOverrideSingleCap() {
        EngineConfig config = EngineConfig.builder().revisionCap(ArtifactKind.ARTICLE, 0).build();

        assertThat(config.getRevisionCap(ArtifactKind.ARTICLE)).isZero();
        assertThat(config.getRevisionCap(ArtifactKind.OUTLINE)).isEqualTo(ArtifactKind.OUTLINE.defaultCap());
    }

    @Test
    void shouldExposeUnmodifiableCaps() {
        EngineConfig config = EngineConfig.builder().revisionCap(ArtifactKind.ARCS, 1).build();

        assertThatThrownBy(() -> config.getRevisionCaps().put(ArtifactKind.ARCS, 5))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> EngineConfig.builder().threadPoolSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("threadPoolSize must be positive");
        assertThatThrownBy(() -> EngineConfig.builder().subStepTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().maxSteps(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().revisionCap(ArtifactKind.OUTLINE, -1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outline");
        assertThatThrownBy(() -> EngineConfig.builder().structuralThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
