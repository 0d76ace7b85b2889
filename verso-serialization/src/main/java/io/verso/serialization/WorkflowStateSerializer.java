package io.verso.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.verso.core.state.WorkflowState;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a {@link WorkflowState} as a flat JSON object keyed by field name, in schema
/// order. Null values are written explicitly so a restored state never falls back to a
/// default it did not hold.
///
/// @implNote Package-private. Registered by {@link VersoJacksonModule}.
/// @see WorkflowStateDeserializer for the inverse operation
class WorkflowStateSerializer extends StdSerializer<WorkflowState> {

    @Serial private static final long serialVersionUID = 7419236358027701164L;

    WorkflowStateSerializer() {
        super(WorkflowState.class);
    }

    @Override
    public void serialize(WorkflowState state, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> entry : state.toMap().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
