package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.genoflow.core.plan.ConfigValues;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.PlanMetadata;
import io.genoflow.core.plan.TaskSpec;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link Plan} to its persisted JSON form.
///
/// Output format:
/// {@snippet lang=json :
/// {
///   "metadata": {
///     "createdAt": "2025-01-01T00:00:00Z",
///     "formatVersion": 1,
///     "analysisType": "variant-analysis",
///     "runParameters": { "sampleName": "NA12878" }
///   },
///   "tasks": [
///     { "id": "variant_filter", "type": "variant_filter", "dependsOn": [], "config": { } }
///   ]
/// }
/// }
///
/// Config values are written in raw form, so output references appear as their
/// `${output.T.K}` text and are parsed again on read.
///
/// @implNote Package-private. Registered by {@link GenoflowJacksonModule}.
/// @see PlanDeserializer for the inverse operation
class PlanSerializer extends StdSerializer<Plan> {

    @Serial private static final long serialVersionUID = 6120995372268400815L;

    PlanSerializer() {
        super(Plan.class);
    }

    @Override
    public void serialize(Plan plan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        writeMetadata(plan.metadata(), gen, provider);

        gen.writeArrayFieldStart("tasks");
        for (TaskSpec task : plan.tasks()) {
            writeTask(task, gen, provider);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private void writeMetadata(PlanMetadata metadata, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeObjectFieldStart("metadata");
        provider.defaultSerializeField("createdAt", metadata.createdAt(), gen);
        gen.writeNumberField("formatVersion", metadata.formatVersion());
        gen.writeStringField("analysisType", metadata.analysisType());
        provider.defaultSerializeField("runParameters", metadata.runParameters(), gen);
        gen.writeEndObject();
    }

    private void writeTask(TaskSpec task, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", task.id());
        gen.writeStringField("type", task.type());
        gen.writeArrayFieldStart("dependsOn");
        for (String dependency : task.dependsOn()) {
            gen.writeString(dependency);
        }
        gen.writeEndArray();
        provider.defaultSerializeField("config", ConfigValues.toRaw(task.config()), gen);
        if (!task.description().isEmpty()) {
            gen.writeStringField("description", task.description());
        }
        gen.writeEndObject();
    }
}
