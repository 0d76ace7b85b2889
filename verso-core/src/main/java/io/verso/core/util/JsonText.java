package io.verso.core.util;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/// Renders plain values (maps, collections, strings, numbers, booleans) as JSON text.
///
/// Values of other types are rendered as JSON strings of their `toString()`. NaN and
/// infinite doubles and floats have no JSON form and are rendered as `null`.
public final class JsonText {

    private JsonText() {}

    /// Renders `value` as indented JSON.
    public static String render(Object value) {
        StringBuilder out = new StringBuilder();
        write(out, value, 0);
        return out.toString();
    }

    private static void write(StringBuilder out, Object value, int depth) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Map<?, ?> map) {
            writeEntries(out, map, depth);
        } else if (value instanceof Collection<?> collection) {
            writeElements(out, collection, depth);
        } else if (isNonFinite(value)) {
            out.append("null");
        } else if (value instanceof Number || value instanceof Boolean) {
            out.append(value);
        } else {
            out.append('"').append(escape(value.toString())).append('"');
        }
    }

    private static boolean isNonFinite(Object value) {
        if (value instanceof Double d) {
            return !Double.isFinite(d);
        }
        if (value instanceof Float f) {
            return !Float.isFinite(f);
        }
        return false;
    }

    private static void writeEntries(StringBuilder out, Map<?, ?> map, int depth) {
        if (map.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<?, ?> entry = it.next();
            indent(out, depth + 1);
            out.append('"').append(escape(String.valueOf(entry.getKey()))).append("\": ");
            write(out, entry.getValue(), depth + 1);
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        indent(out, depth);
        out.append('}');
    }

    private static void writeElements(StringBuilder out, Collection<?> collection, int depth) {
        if (collection.isEmpty()) {
            out.append("[]");
            return;
        }
        out.append("[\n");
        Iterator<?> it = collection.iterator();
        while (it.hasNext()) {
            indent(out, depth + 1);
            write(out, it.next(), depth + 1);
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        indent(out, depth);
        out.append(']');
    }

    private static void indent(StringBuilder out, int depth) {
        out.append("  ".repeat(depth));
    }

    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> escaped.append("\\\"");
                case '\\' -> escaped.append("\\\\");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (c < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.toString();
    }
}
