package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.PlanMetadata;
import io.genoflow.core.plan.TaskSpec;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Deserializes a {@link Plan} written by {@link PlanSerializer}.
///
/// Task specs are rebuilt through their constructors, so config strings are
/// parsed into output references again and the result compares equal to the
/// plan that was written. Plans written by a newer format version are rejected.
///
/// @implNote Package-private. Registered by {@link GenoflowJacksonModule}.
/// @see PlanSerializer for the output format
class PlanDeserializer extends StdDeserializer<Plan> {

    @Serial private static final long serialVersionUID = -4486132265391062273L;

    PlanDeserializer() {
        super(Plan.class);
    }

    @Override
    public Plan deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = ctx.readTree(p);

        PlanMetadata metadata = readMetadata(root.path("metadata"), p, ctx);

        List<TaskSpec> tasks = new ArrayList<>();
        for (JsonNode taskNode : root.path("tasks")) {
            tasks.add(readTask(taskNode, p));
        }

        try {
            return new Plan(tasks, metadata);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw JsonMappingException.from(p, "Invalid plan: " + e.getMessage(), e);
        }
    }

    private PlanMetadata readMetadata(JsonNode node, JsonParser p, DeserializationContext ctx)
            throws IOException {
        int formatVersion = node.path("formatVersion").asInt(PlanMetadata.CURRENT_FORMAT_VERSION);
        if (formatVersion > PlanMetadata.CURRENT_FORMAT_VERSION) {
            throw JsonMappingException.from(
                    p,
                    "Unsupported plan format version "
                            + formatVersion
                            + " (supported up to "
                            + PlanMetadata.CURRENT_FORMAT_VERSION
                            + ")");
        }
        JsonNode createdAtNode = node.get("createdAt");
        if (createdAtNode == null || createdAtNode.isNull()) {
            throw JsonMappingException.from(p, "Plan metadata is missing 'createdAt'");
        }
        Instant createdAt = ctx.readTreeAsValue(createdAtNode, Instant.class);
        String analysisType = node.hasNonNull("analysisType") ? node.get("analysisType").asText() : "";

        try {
            return new PlanMetadata(
                    createdAt,
                    formatVersion,
                    analysisType,
                    JsonValues.toMap(node.get("runParameters"), false));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid plan metadata: " + e.getMessage(), e);
        }
    }

    private TaskSpec readTask(JsonNode node, JsonParser p) throws IOException {
        String id = requiredText(node, "id", p);
        String type = requiredText(node, "type", p);

        Set<String> dependsOn = new LinkedHashSet<>();
        for (JsonNode dependency : node.path("dependsOn")) {
            dependsOn.add(dependency.asText());
        }

        String description = node.hasNonNull("description") ? node.get("description").asText() : null;

        try {
            return new TaskSpec(
                    id, type, dependsOn, JsonValues.toMap(node.get("config"), false), description);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid task '" + id + "': " + e.getMessage(), e);
        }
    }

    private String requiredText(JsonNode node, String field, JsonParser p) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw JsonMappingException.from(p, "Task is missing required field '" + field + "'");
        }
        return value.textValue();
    }
}
