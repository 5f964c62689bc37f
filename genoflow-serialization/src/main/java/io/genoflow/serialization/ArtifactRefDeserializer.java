package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.genoflow.core.artifact.ArtifactRef;
import java.io.IOException;
import java.io.Serial;

/// Deserializes an {@link ArtifactRef} written by {@link ArtifactRefSerializer}.
///
/// @implNote Package-private. Registered by {@link GenoflowJacksonModule}.
class ArtifactRefDeserializer extends StdDeserializer<ArtifactRef> {

    @Serial private static final long serialVersionUID = -1827340913586241107L;

    ArtifactRefDeserializer() {
        super(ArtifactRef.class);
    }

    @Override
    public ArtifactRef deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = ctx.readTree(p);
        if (!JsonValues.isArtifact(root)) {
            return ctx.reportInputMismatch(
                    ArtifactRef.class,
                    "Artifact reference requires a textual '%s' field",
                    JsonValues.ARTIFACT_FIELD);
        }
        return JsonValues.toArtifact(root);
    }
}
