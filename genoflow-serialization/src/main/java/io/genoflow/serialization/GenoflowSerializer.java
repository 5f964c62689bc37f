package io.genoflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.genoflow.core.critic.FindingsReport;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.state.RunSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// Utility class for serializing plans, run snapshots and findings reports
/// to and from JSON.
///
/// ### Usage
/// {@snippet :
/// // Persist a compiled plan next to the run outputs
/// GenoflowSerializer.writePlan(plan, outputDir.resolve("plan.json"));
///
/// // Reload it later; the result equals the original
/// Plan restored = GenoflowSerializer.readPlan(outputDir.resolve("plan.json"));
/// }
///
/// @implNote Thread-safe. A single mapper built by {@link #createMapper()} is
/// shared by the static methods.
///
/// @see GenoflowJacksonModule for the registered type handlers
public final class GenoflowSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private GenoflowSerializer() {}

    /// Serializes a plan to pretty-printed JSON.
    ///
    /// @param plan the plan to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Plan plan) {
        return write(plan, "plan");
    }

    /// Deserializes a plan from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized plan, never null
    /// @throws IllegalArgumentException if the JSON is malformed, invalid, or of a
    ///     newer format version
    public static Plan planFromJson(String json) {
        return read(json, Plan.class, "plan");
    }

    public static String toJson(RunSnapshot snapshot) {
        return write(snapshot, "run snapshot");
    }

    public static RunSnapshot snapshotFromJson(String json) {
        return read(json, RunSnapshot.class, "run snapshot");
    }

    /// Serializes a findings report, including its derived overall status.
    ///
    /// @param report the report, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FindingsReport report) {
        return write(report, "findings report");
    }

    public static FindingsReport reportFromJson(String json) {
        return read(json, FindingsReport.class, "findings report");
    }

    /// Writes a plan to a file, replacing any existing content.
    ///
    /// @param plan the plan, not null
    /// @param file target file, not null; parent directories are created
    /// @throws IOException if the file cannot be written
    public static void writePlan(Plan plan, Path file) throws IOException {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(file, "file must not be null");
        createParent(file);
        MAPPER.writeValue(file.toFile(), plan);
    }

    /// Reads a plan from a file.
    ///
    /// @param file source file, not null
    /// @return the plan, never null
    /// @throws IOException if the file cannot be read or holds no valid plan
    public static Plan readPlan(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        return MAPPER.readValue(file.toFile(), Plan.class);
    }

    public static void writeReport(FindingsReport report, Path file) throws IOException {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(file, "file must not be null");
        createParent(file);
        MAPPER.writeValue(file.toFile(), report);
    }

    /// Creates an ObjectMapper configured for Genoflow serialization.
    ///
    /// Registers:
    /// - `GenoflowJacksonModule` for plans, results and artifact references
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new GenoflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        Objects.requireNonNull(value, what + " must not be null");
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
