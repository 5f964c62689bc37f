package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.genoflow.core.execution.TaskResult;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link TaskResult}, omitting fields that are null.
///
/// Output values are written with the mapper's serializers, so artifact
/// pointers use the `$artifact` form of {@link ArtifactRefSerializer}.
///
/// @implNote Package-private. Registered by {@link GenoflowJacksonModule}.
/// @see TaskResultDeserializer for the inverse operation
class TaskResultSerializer extends StdSerializer<TaskResult> {

    @Serial private static final long serialVersionUID = 8810347125534902614L;

    TaskResultSerializer() {
        super(TaskResult.class);
    }

    @Override
    public void serialize(TaskResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("taskId", result.taskId());
        gen.writeStringField("status", result.status().name());
        provider.defaultSerializeField("outputs", result.outputs(), gen);
        if (result.error() != null) {
            provider.defaultSerializeField("error", result.error(), gen);
        }
        if (result.skipReason() != null) {
            gen.writeStringField("skipReason", result.skipReason());
        }
        if (result.startedAt() != null) {
            provider.defaultSerializeField("startedAt", result.startedAt(), gen);
        }
        if (result.finishedAt() != null) {
            provider.defaultSerializeField("finishedAt", result.finishedAt(), gen);
        }
        gen.writeEndObject();
    }
}
