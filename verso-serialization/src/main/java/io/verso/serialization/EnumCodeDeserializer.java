package io.verso.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.io.Serial;
import java.util.function.Function;

/// Reads an enum constant from its persisted code.
///
/// @implNote Package-private. Registered by {@link VersoJacksonModule}.
/// @see EnumCodeSerializer for the inverse operation
class EnumCodeDeserializer<E extends Enum<E>> extends StdDeserializer<E> {

    @Serial private static final long serialVersionUID = -6126017712457180993L;

    private final Class<E> type;
    private final transient Function<String, E> fromCode;

    EnumCodeDeserializer(Class<E> type, Function<String, E> fromCode) {
        super(type);
        this.type = type;
        this.fromCode = fromCode;
    }

    /// @throws IOException if the token is not a string or the code is unknown
    @Override
    public E deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return type.cast(ctxt.handleUnexpectedToken(type, p));
        }
        return resolve(p.getText(), ctxt);
    }

    private E resolve(String code, DeserializationContext ctxt) throws IOException {
        try {
            return fromCode.apply(code);
        } catch (IllegalArgumentException e) {
            return type.cast(ctxt.handleWeirdStringValue(type, code, e.getMessage()));
        }
    }

    /// Key variant used for maps keyed by the enum, such as revision counts per kind.
    static <E extends Enum<E>> KeyDeserializer key(Class<E> type, Function<String, E> fromCode) {
        return new KeyDeserializer() {
            @Override
            public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
                try {
                    return fromCode.apply(key);
                } catch (IllegalArgumentException e) {
                    return ctxt.handleWeirdKey(type, key, e.getMessage());
                }
            }
        };
    }
}
