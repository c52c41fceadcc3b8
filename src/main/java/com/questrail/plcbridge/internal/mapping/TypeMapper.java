package com.questrail.plcbridge.internal.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.plcbridge.api.PrimitiveType;
import com.questrail.plcbridge.api.VariableKind;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * TypeMapper
 * =============================================================================
 * Stateless conversions between domain values (what control modules send and
 * accept) and protocol primitives (what the telemetry side carries).
 *
 * <h2>Forward direction</h2>
 * <ul>
 *   <li>{@link VariableKind#NUMBER}  → {@code Double}; text is parsed, unparseable text becomes {@code NaN}</li>
 *   <li>{@link VariableKind#BOOLEAN} → {@code Boolean}; {@code "true"/"1"/"on"/"yes"} are true</li>
 *   <li>{@link VariableKind#TEXT}    → {@code String}; maps and lists are rendered as JSON</li>
 *   <li>{@link VariableKind#STRUCTURED} without a template → JSON {@code String}</li>
 * </ul>
 *
 * <h2>Reverse direction</h2>
 * Commands arriving from the telemetry side go through {@link #toDomain}. For
 * variables the bridge has never seen, {@link #inferDomain} keeps the payload's
 * own runtime shape.
 */
public final class TypeMapper
{
    private static final ObjectMapper JSON = new ObjectMapper();

    private TypeMapper() {}

    /**
     * Corrects a declared kind against the literal value. A numeric literal is
     * always a {@link VariableKind#NUMBER} and a boolean literal always a
     * {@link VariableKind#BOOLEAN}, whatever the module declared.
     */
    public static VariableKind resolveKind(VariableKind declared, Object value) {
        Objects.requireNonNull(declared, "declared");
        if (value instanceof Number) {
            return VariableKind.NUMBER;
        }
        if (value instanceof Boolean) {
            return VariableKind.BOOLEAN;
        }
        return declared;
    }

    /**
     * Primitive type a scalar kind is published as. Structured kinds are
     * {@link PrimitiveType#STRING} here; template-backed representations are
     * decided by {@link TemplateDecomposer}.
     */
    public static PrimitiveType primitiveTypeOf(VariableKind kind) {
        return switch (kind) {
            case NUMBER -> PrimitiveType.DOUBLE;
            case BOOLEAN -> PrimitiveType.BOOLEAN;
            case TEXT, STRUCTURED -> PrimitiveType.STRING;
        };
    }

    /**
     * Converts a domain value to the primitive published for {@code kind}.
     * {@code null} stays {@code null}.
     */
    public static Object toPrimitive(Object value, VariableKind kind) {
        if (value == null) {
            return null;
        }
        return switch (kind) {
            case NUMBER -> toDouble(value);
            case BOOLEAN -> toBoolean(value);
            case TEXT, STRUCTURED -> toText(value);
        };
    }

    /**
     * Converts a protocol primitive received in a command back to the domain
     * value expected by a variable of {@code kind}. {@code null} stays
     * {@code null} for numbers and text.
     */
    public static Object toDomain(Object value, VariableKind kind) {
        return switch (kind) {
            case NUMBER -> value == null ? null : toDouble(value);
            case BOOLEAN -> toBoolean(value);
            case TEXT -> value == null ? null : String.valueOf(value);
            case STRUCTURED -> toStructured(value);
        };
    }

    /**
     * Best-effort conversion for a command aimed at an unknown variable:
     * booleans, numbers and strings pass through unchanged, anything else is
     * stringified.
     */
    public static Object inferDomain(Object value) {
        if (value instanceof Boolean || value instanceof Number || value instanceof String) {
            return value;
        }
        return String.valueOf(value);
    }

    /**
     * Renders any value as JSON text.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON-serializable: " + value, e);
        }
    }

    /**
     * Reads a structured value as a member map. Accepts a map or a JSON object
     * string.
     *
     * @throws IllegalArgumentException if the value has no member structure
     */
    public static Map<String, Object> asMemberMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> members = new LinkedHashMap<>();
            map.forEach((k, v) -> members.put(String.valueOf(k), v));
            return members;
        }
        if (value instanceof String text) {
            try {
                return JSON.readValue(text, new TypeReference<LinkedHashMap<String, Object>>() {});
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("structured value is not a JSON object", e);
            }
        }
        throw new IllegalArgumentException("structured value must be an object, got "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String t = s.trim().toLowerCase(Locale.ROOT);
            return t.equals("true") || t.equals("1") || t.equals("on") || t.equals("yes");
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        return value != null;
    }

    private static String toText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return toJson(value);
        }
        return String.valueOf(value);
    }

    private static Object toStructured(Object value) {
        if (value instanceof String text) {
            try {
                return asMemberMap(text);
            } catch (IllegalArgumentException e) {
                return text;
            }
        }
        return value;
    }
}
