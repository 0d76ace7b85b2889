package io.verso.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.verso.core.state.StateField;
import io.verso.core.state.StateSchema;
import io.verso.core.state.WorkflowState;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads a {@link WorkflowState} written by {@link WorkflowStateSerializer}.
///
/// Each value is converted to its field's declared type: typed list fields are read
/// element by element (records such as evaluation and error entries), map and untyped
/// list fields become plain JSON structures, everything else is read as the field's
/// value type. Fields missing from the document take their defaults.
///
/// @implNote Package-private. Registered by {@link VersoJacksonModule}.
class WorkflowStateDeserializer extends StdDeserializer<WorkflowState> {

    @Serial private static final long serialVersionUID = 4978771924610683309L;

    private final transient StateSchema schema;

    WorkflowStateDeserializer(StateSchema schema) {
        super(WorkflowState.class);
        this.schema = schema;
    }

    /// @throws io.verso.core.exception.UnknownStateFieldException for a name the schema
    ///     does not declare
    /// @throws IOException if a value cannot be converted to its field's type
    @Override
    public WorkflowState deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            return (WorkflowState) ctxt.handleUnexpectedToken(WorkflowState.class, p);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            StateField<?, ?> field = schema.require(entry.getKey());
            values.put(field.name(), read(mapper, field, entry.getValue()));
        }
        return WorkflowState.restore(schema, values);
    }

    private static Object read(ObjectMapper mapper, StateField<?, ?> field, JsonNode node)
            throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (field.elementType() != null && node.isArray()) {
            List<Object> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(element.isNull() ? null : mapper.treeToValue(element, field.elementType()));
            }
            return elements;
        }
        return mapper.treeToValue(node, field.valueType());
    }
}
