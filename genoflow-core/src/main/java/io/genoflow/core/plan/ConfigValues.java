package io.genoflow.core.plan;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Canonical form of task configuration values.
///
/// Every config map stored in a {@link TaskSpec} passes through
/// {@link #normalize(Map)}, which:
/// - parses strings holding `${output.T.K}` into {@link OutputReference} or
///   {@link ReferenceTemplate}
/// - narrows integral numbers to `Integer` when they fit, otherwise `Long`,
///   and widens other numbers to `Double`
/// - deep-copies maps (keys as strings, insertion order kept) and collections
///   (as lists) into unmodifiable containers that tolerate `null` values
/// - stores any other object as its `toString()`
///
/// The canonical form is what makes a persisted plan compare equal to the
/// original after a JSON round trip.
public final class ConfigValues {

    private ConfigValues() {}

    /// Normalizes a configuration map, parsing output references.
    ///
    /// @param config raw configuration, may be null (treated as empty)
    /// @return unmodifiable canonical map, never null
    public static Map<String, Object> normalize(Map<String, ?> config) {
        return normalizeMap(config, true, false);
    }

    /// Normalizes a map of literal values. Reference syntax is kept as plain text.
    ///
    /// @param values raw values, may be null (treated as empty)
    /// @return unmodifiable canonical map, never null
    public static Map<String, Object> normalizeLiteral(Map<String, ?> values) {
        return normalizeMap(values, false, false);
    }

    /// Normalizes task outputs. Numbers, maps and collections take their canonical
    /// form and strings stay literal. Other objects, such as artifact references, are
    /// kept as they are.
    ///
    /// @param outputs outputs returned by a task body, may be null (treated as empty)
    /// @return unmodifiable canonical map, never null
    public static Map<String, Object> normalizeOutputs(Map<String, ?> outputs) {
        return normalizeMap(outputs, false, true);
    }

    /// Normalizes a single value.
    ///
    /// @param value raw value, may be null
    /// @param parseReferences whether strings are scanned for references
    /// @return canonical value, may be null
    public static Object normalizeValue(Object value, boolean parseReferences) {
        return normalize(value, parseReferences, false);
    }

    private static Object normalize(Object value, boolean parseReferences, boolean keepOpaque) {
        if (value == null
                || value instanceof Boolean
                || value instanceof OutputReference
                || value instanceof ReferenceTemplate) {
            return value;
        }
        if (value instanceof String text) {
            return parseReferences ? parseText(text) : text;
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof Map<?, ?> map) {
            return normalizeMap(map, parseReferences, keepOpaque);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(normalize(item, parseReferences, keepOpaque));
            }
            return Collections.unmodifiableList(copy);
        }
        if (keepOpaque) {
            return value;
        }
        return parseReferences ? parseText(value.toString()) : value.toString();
    }

    /// Collects every output reference occurring in a value, depth first.
    ///
    /// @param value canonical config value, may be null
    /// @return references in order of appearance, never null
    public static List<OutputReference> references(Object value) {
        List<OutputReference> found = new ArrayList<>();
        collect(value, found);
        return found;
    }

    /// Converts a canonical value back to plain data, rendering references as
    /// their `${output.T.K}` text.
    ///
    /// @param value canonical value, may be null
    /// @return plain value made of strings, numbers, booleans, lists and maps
    public static Object toRaw(Object value) {
        if (value instanceof OutputReference ref) {
            return ref.expression();
        }
        if (value instanceof ReferenceTemplate template) {
            return template.template();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> raw = new LinkedHashMap<>();
            map.forEach((k, v) -> raw.put(String.valueOf(k), toRaw(v)));
            return raw;
        }
        if (value instanceof List<?> list) {
            List<Object> raw = new ArrayList<>(list.size());
            list.forEach(item -> raw.add(toRaw(item)));
            return raw;
        }
        return value;
    }

    private static Map<String, Object> normalizeMap(
            Map<?, ?> map, boolean parseReferences, boolean keepOpaque) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(
                    String.valueOf(entry.getKey()),
                    normalize(entry.getValue(), parseReferences, keepOpaque));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object parseText(String text) {
        if (!OutputReference.containsReference(text)) {
            return text;
        }
        Optional<OutputReference> exact = OutputReference.parse(text);
        if (exact.isPresent()) {
            return exact.get();
        }
        return ReferenceTemplate.parse(text);
    }

    private static Number normalizeNumber(Number number) {
        if (number instanceof Integer) {
            return number;
        }
        if (number instanceof Long
                || number instanceof Short
                || number instanceof Byte
                || number instanceof BigInteger) {
            if (number instanceof BigInteger big && big.bitLength() > 63) {
                return big.doubleValue();
            }
            long asLong = number.longValue();
            if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                return (int) asLong;
            }
            return asLong;
        }
        if (number instanceof BigDecimal decimal && decimal.scale() <= 0) {
            return normalizeNumber(decimal.toBigInteger());
        }
        return number.doubleValue();
    }

    private static void collect(Object value, List<OutputReference> found) {
        if (value instanceof OutputReference ref) {
            found.add(ref);
        } else if (value instanceof ReferenceTemplate template) {
            found.addAll(template.references());
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collect(v, found));
        } else if (value instanceof Collection<?> collection) {
            collection.forEach(v -> collect(v, found));
        }
    }
}
