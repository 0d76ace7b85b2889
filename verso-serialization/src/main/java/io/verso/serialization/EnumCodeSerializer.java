package io.verso.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;
import java.util.function.Function;

/// Writes an enum constant as its persisted code, either as a value or as a map key.
///
/// Codes are stable identifiers such as `"3.1"` for a phase or `"outline"` for an
/// approval type, so renaming a constant never invalidates stored snapshots.
///
/// @implNote Package-private. Registered by {@link VersoJacksonModule}.
/// @see EnumCodeDeserializer for the inverse operation
class EnumCodeSerializer<E extends Enum<E>> extends StdSerializer<E> {

    @Serial private static final long serialVersionUID = 2630170139432874414L;

    private final transient Function<E, String> toCode;
    private final boolean asKey;

    private EnumCodeSerializer(Class<E> type, Function<E, String> toCode, boolean asKey) {
        super(type);
        this.toCode = toCode;
        this.asKey = asKey;
    }

    static <E extends Enum<E>> EnumCodeSerializer<E> value(Class<E> type, Function<E, String> toCode) {
        return new EnumCodeSerializer<>(type, toCode, false);
    }

    static <E extends Enum<E>> EnumCodeSerializer<E> key(Class<E> type, Function<E, String> toCode) {
        return new EnumCodeSerializer<>(type, toCode, true);
    }

    @Override
    public void serialize(E value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (asKey) {
            gen.writeFieldName(toCode.apply(value));
        } else {
            gen.writeString(toCode.apply(value));
        }
    }
}
