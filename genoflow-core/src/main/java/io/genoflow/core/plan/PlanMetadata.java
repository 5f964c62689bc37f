package io.genoflow.core.plan;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Plan-level metadata, persisted with the plan.
///
/// @param createdAt when the plan was compiled, not null
/// @param formatVersion persistence format version, positive
/// @param analysisType template that produced the plan, not null (empty for hand-built plans)
/// @param runParameters parameters the plan was compiled with, literal values, not null
public record PlanMetadata(
        Instant createdAt, int formatVersion, String analysisType, Map<String, Object> runParameters) {

    /// Format version written by this release.
    public static final int CURRENT_FORMAT_VERSION = 1;

    public PlanMetadata {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (formatVersion < 1) {
            throw new IllegalArgumentException("formatVersion must be >= 1");
        }
        analysisType = analysisType != null ? analysisType : "";
        runParameters = ConfigValues.normalizeLiteral(runParameters);
    }

    /// Creates metadata stamped now with the current format version.
    ///
    /// @param analysisType template id, may be null
    /// @param runParameters compile parameters, may be null
    /// @return new metadata, never null
    public static PlanMetadata now(String analysisType, Map<String, ?> runParameters) {
        return new PlanMetadata(
                Instant.now(),
                CURRENT_FORMAT_VERSION,
                analysisType,
                ConfigValues.normalizeLiteral(runParameters));
    }

    public PlanMetadata withCreatedAt(Instant timestamp) {
        return new PlanMetadata(timestamp, formatVersion, analysisType, runParameters);
    }
}
