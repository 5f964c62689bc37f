package io.genoflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.genoflow.core.critic.FindingsReport;
import io.genoflow.core.critic.ReportStatus;

/// Jackson mixin for {@link FindingsReport}.
///
/// Writes the derived overall `status` next to the findings so report files
/// can be read without recomputing it. On read the field is ignored and the
/// status is derived again from the findings.
///
/// @see io.genoflow.serialization.GenoflowJacksonModule for registration
@JsonIgnoreProperties(value = "status", allowGetters = true)
public abstract class FindingsReportMixin {

    @JsonProperty("status")
    public abstract ReportStatus status();
}
