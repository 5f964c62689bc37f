package io.genoflow.core.artifact;

import java.util.Objects;

/// Opaque pointer to a task output held outside the result map.
///
/// Sequence windows, embedding matrices and evidence tables are too large to
/// keep inline. Task bodies write them to an {@link ArtifactStore} and return
/// the locator as an output value. The executor passes locators through
/// unchanged; only bodies and stores interpret them.
///
/// @param locator store-specific address, not null or blank
/// @param mediaType content type hint (e.g. `text/tab-separated-values`), may be null
public record ArtifactRef(String locator, String mediaType) {

    public ArtifactRef {
        Objects.requireNonNull(locator, "locator must not be null");
        if (locator.isBlank()) {
            throw new IllegalArgumentException("locator must not be blank");
        }
    }

    /// Creates a reference without a media type.
    ///
    /// @param locator store-specific address, not null
    /// @return new reference, never null
    public static ArtifactRef of(String locator) {
        return new ArtifactRef(locator, null);
    }
}
