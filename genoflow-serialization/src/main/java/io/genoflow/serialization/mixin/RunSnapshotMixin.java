package io.genoflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.genoflow.core.state.RunSnapshot;

/// Jackson mixin for {@link RunSnapshot}.
///
/// Record components serialize as-is. The derived `complete` flag is recomputed
/// from the plan and results, so it is not written.
///
/// @see io.genoflow.serialization.GenoflowJacksonModule for registration
public abstract class RunSnapshotMixin {

    @JsonIgnore
    public abstract boolean isComplete();
}
