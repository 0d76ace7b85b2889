package io.verso.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateSchema;
import io.verso.core.state.WorkflowState;
import io.verso.core.storage.RunSnapshot;
import io.verso.serialization.mixin.RunSnapshotMixin;
import java.io.Serial;
import java.util.Objects;

/// Jackson `SimpleModule` that registers all Verso serialization configuration in one
/// place.
///
/// **Coded enums** are written as their stable identifiers rather than constant names:
/// - `Phase` by {@link Phase#code()}, e.g. `"3.1"`
/// - `ApprovalType`, `ArtifactKind` and `Step` by `id()`; `ArtifactKind` also as a map key
///
/// **Schema-driven state**: `WorkflowState` is written as a flat object and read back
/// field by field, converting each value to the type its {@link StateSchema} declares.
///
/// **Records** (`RunSnapshot`, `EvaluationRecord`, `EscalationRecord`, `ErrorRecord`,
/// `CheckpointPayload`) use Jackson's built-in record support; `RunSnapshot` gets a mixin
/// hiding its derived flags.
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see RunSnapshotSerializer for the convenience factory API
public class VersoJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3306925133417740412L;

    /// Creates the module for the report pipeline schema.
    public VersoJacksonModule() {
        this(ReportFields.SCHEMA);
    }

    /// Creates the module for a custom schema.
    ///
    /// @param schema schema used to restore states, not null
    public VersoJacksonModule(StateSchema schema) {
        super("VersoJacksonModule");
        Objects.requireNonNull(schema, "schema must not be null");

        addSerializer(Phase.class, EnumCodeSerializer.value(Phase.class, Phase::code));
        addDeserializer(Phase.class, new EnumCodeDeserializer<>(Phase.class, Phase::fromCode));

        addSerializer(ApprovalType.class, EnumCodeSerializer.value(ApprovalType.class, ApprovalType::id));
        addDeserializer(ApprovalType.class, new EnumCodeDeserializer<>(ApprovalType.class, ApprovalType::fromId));

        addSerializer(Step.class, EnumCodeSerializer.value(Step.class, Step::id));
        addDeserializer(Step.class, new EnumCodeDeserializer<>(Step.class, Step::fromId));

        addSerializer(ArtifactKind.class, EnumCodeSerializer.value(ArtifactKind.class, ArtifactKind::id));
        addDeserializer(
                ArtifactKind.class, new EnumCodeDeserializer<>(ArtifactKind.class, ArtifactKind::fromId));
        addKeySerializer(ArtifactKind.class, EnumCodeSerializer.key(ArtifactKind.class, ArtifactKind::id));
        addKeyDeserializer(
                ArtifactKind.class, EnumCodeDeserializer.key(ArtifactKind.class, ArtifactKind::fromId));

        addSerializer(WorkflowState.class, new WorkflowStateSerializer());
        addDeserializer(WorkflowState.class, new WorkflowStateDeserializer(schema));
    }

    /// Applies the mixin annotations.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(RunSnapshot.class, RunSnapshotMixin.class);
    }
}
