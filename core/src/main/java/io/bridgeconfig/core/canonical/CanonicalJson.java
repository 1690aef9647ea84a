package io.bridgeconfig.core.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Writes a JSON tree in the canonical text form that state file checksums are computed over.
 *
 * <p>
 * The output is byte-identical to Python's {@code json.dumps(value, indent=4)} followed by a
 * newline, which is how already-published state files were hashed:
 * <ul>
 * <li>4-space indentation, one member or element per line, {@code ": "} after keys</li>
 * <li>empty objects and arrays as {@code {}} and {@code []}</li>
 * <li>ASCII only: characters outside {@code 0x20..0x7e} are written as
 * backslash-u escapes with four lower-case hex digits, except the short escapes for
 * backspace, form feed, newline, carriage return and tab</li>
 * <li>member order is the tree's insertion order</li>
 * </ul>
 *
 * <p>
 * Only objects, arrays, strings, integers, booleans and null are supported. Thread-safe.
 */
public final class CanonicalJson {

    private static final String INDENT = "    ";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private CanonicalJson() {}

    /**
     * Renders {@code node} in canonical form, including the trailing newline.
     *
     * @throws IllegalArgumentException if the tree contains a floating point or binary value
     */
    public static String write(JsonNode node) {
        StringBuilder out = new StringBuilder(256);
        writeValue(node, 0, out);
        out.append('\n');
        return out.toString();
    }

    private static void writeValue(JsonNode node, int depth, StringBuilder out) {
        if (node.isObject()) {
            writeObject(node, depth, out);
        } else if (node.isArray()) {
            writeArray(node, depth, out);
        } else if (node.isTextual()) {
            writeString(node.textValue(), out);
        } else if (node.isIntegralNumber()) {
            out.append(node.bigIntegerValue());
        } else if (node.isBoolean()) {
            out.append(node.booleanValue() ? "true" : "false");
        } else if (node.isNull()) {
            out.append("null");
        } else {
            throw new IllegalArgumentException("Value not representable in canonical form: " + node.getNodeType());
        }
    }

    private static void writeObject(JsonNode node, int depth, StringBuilder out) {
        if (node.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        boolean first = true;
        for (Map.Entry<String, JsonNode> member : node.properties()) {
            if (!first) {
                out.append(",\n");
            }
            first = false;
            indent(depth + 1, out);
            writeString(member.getKey(), out);
            out.append(": ");
            writeValue(member.getValue(), depth + 1, out);
        }
        out.append('\n');
        indent(depth, out);
        out.append('}');
    }

    private static void writeArray(JsonNode node, int depth, StringBuilder out) {
        if (node.isEmpty()) {
            out.append("[]");
            return;
        }
        out.append("[\n");
        for (int i = 0; i < node.size(); i++) {
            if (i > 0) {
                out.append(",\n");
            }
            indent(depth + 1, out);
            writeValue(node.get(i), depth + 1, out);
        }
        out.append('\n');
        indent(depth, out);
        out.append(']');
    }

    static void writeString(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        // surrogate pairs come out as two escapes, one per UTF-16 unit
                        out.append("\\u")
                                .append(HEX[(c >> 12) & 0xf])
                                .append(HEX[(c >> 8) & 0xf])
                                .append(HEX[(c >> 4) & 0xf])
                                .append(HEX[c & 0xf]);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static void indent(int depth, StringBuilder out) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }
}
