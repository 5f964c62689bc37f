package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.genoflow.core.execution.TaskFailure;
import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.execution.TaskStatus;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;

/// Deserializes a {@link TaskResult} written by {@link TaskResultSerializer}.
///
/// Output values come back as plain data (strings, numbers, booleans, lists and
/// maps), with `$artifact` objects restored to artifact references.
///
/// @implNote Package-private. Registered by {@link GenoflowJacksonModule}.
class TaskResultDeserializer extends StdDeserializer<TaskResult> {

    @Serial private static final long serialVersionUID = 1593771406082843117L;

    TaskResultDeserializer() {
        super(TaskResult.class);
    }

    @Override
    public TaskResult deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = ctx.readTree(p);

        String taskId = root.path("taskId").asText(null);
        if (taskId == null) {
            throw JsonMappingException.from(p, "Task result is missing 'taskId'");
        }
        TaskStatus status;
        try {
            status = TaskStatus.valueOf(root.path("status").asText());
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Unknown status for task '" + taskId + "': " + root.path("status").asText(), e);
        }

        JsonNode errorNode = root.get("error");
        TaskFailure error =
                errorNode != null && !errorNode.isNull()
                        ? ctx.readTreeAsValue(errorNode, TaskFailure.class)
                        : null;

        try {
            return new TaskResult(
                    taskId,
                    status,
                    JsonValues.toMap(root.get("outputs"), true),
                    error,
                    root.hasNonNull("skipReason") ? root.get("skipReason").asText() : null,
                    readInstant(root.get("startedAt"), ctx),
                    readInstant(root.get("finishedAt"), ctx));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Invalid result for task '" + taskId + "': " + e.getMessage(), e);
        }
    }

    private Instant readInstant(JsonNode node, DeserializationContext ctx) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        return ctx.readTreeAsValue(node, Instant.class);
    }
}
