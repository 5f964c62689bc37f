package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.genoflow.core.artifact.ArtifactRef;
import java.io.IOException;
import java.io.Serial;

/// Serializes an {@link ArtifactRef} as `{"$artifact":"<locator>","mediaType":"..."}`.
///
/// The `$artifact` marker lets output maps, which hold arbitrary values, tell
/// artifact pointers apart from inline objects when read back. `mediaType` is
/// omitted when null.
///
/// @implNote Package-private. Registered by {@link GenoflowJacksonModule}.
/// @see ArtifactRefDeserializer for the inverse operation
class ArtifactRefSerializer extends StdSerializer<ArtifactRef> {

    @Serial private static final long serialVersionUID = 3954287310426719850L;

    ArtifactRefSerializer() {
        super(ArtifactRef.class);
    }

    @Override
    public void serialize(ArtifactRef ref, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(JsonValues.ARTIFACT_FIELD, ref.locator());
        if (ref.mediaType() != null) {
            gen.writeStringField(JsonValues.MEDIA_TYPE_FIELD, ref.mediaType());
        }
        gen.writeEndObject();
    }
}
