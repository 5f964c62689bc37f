package io.genoflow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.genoflow.core.artifact.ArtifactRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts JSON trees into the plain values used by plans and task results.
///
/// Integral numbers become `Integer`, `Long` or `BigInteger` by size, other
/// numbers `Double`. Object key order is kept. When artifact pointers are
/// enabled, an object carrying a textual `$artifact` field becomes an
/// {@link ArtifactRef}.
final class JsonValues {

    /// Field naming the locator of a serialized {@link ArtifactRef}.
    static final String ARTIFACT_FIELD = "$artifact";

    static final String MEDIA_TYPE_FIELD = "mediaType";

    private JsonValues() {}

    static Map<String, Object> toMap(JsonNode node, boolean artifacts) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), toValue(field.getValue(), artifacts));
        }
        return Collections.unmodifiableMap(map);
    }

    static Object toValue(JsonNode node, boolean artifacts) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            if (artifacts && isArtifact(node)) {
                return toArtifact(node);
            }
            return toMap(node, artifacts);
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(item -> list.add(toValue(item, artifacts)));
            return Collections.unmodifiableList(list);
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isLong()) {
            return node.longValue();
        }
        if (node.isBigInteger()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    static boolean isArtifact(JsonNode node) {
        return node.has(ARTIFACT_FIELD) && node.get(ARTIFACT_FIELD).isTextual();
    }

    static ArtifactRef toArtifact(JsonNode node) {
        JsonNode mediaType = node.get(MEDIA_TYPE_FIELD);
        return new ArtifactRef(
                node.get(ARTIFACT_FIELD).textValue(),
                mediaType != null && !mediaType.isNull() ? mediaType.asText() : null);
    }
}
