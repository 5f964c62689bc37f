package io.genoflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.genoflow.core.artifact.ArtifactRef;
import io.genoflow.core.critic.FindingsReport;
import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.state.RunSnapshot;
import io.genoflow.serialization.mixin.FindingsReportMixin;
import io.genoflow.serialization.mixin.RunSnapshotMixin;
import java.io.Serial;

/// Jackson module for Genoflow plans, run snapshots and findings reports.
///
/// Registers custom serializers for the types whose JSON form differs from
/// their record layout, and mixins for records that only need small tweaks.
///
/// ### Custom serializers
/// - {@link Plan}: config values are written in raw `${output.T.K}` form and
///   parsed again on read
/// - {@link TaskResult}: null fields omitted, artifact outputs restored
/// - {@link ArtifactRef}: `$artifact` marker form
///
/// Other records ({@code Finding}, {@code TaskFailure}) use Jackson's built-in
/// record support.
///
/// @see GenoflowSerializer#createMapper() for pre-configured ObjectMapper
public class GenoflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = -6723185100457298113L;

    public GenoflowJacksonModule() {
        super("GenoflowModule");

        addSerializer(Plan.class, new PlanSerializer());
        addDeserializer(Plan.class, new PlanDeserializer());

        addSerializer(TaskResult.class, new TaskResultSerializer());
        addDeserializer(TaskResult.class, new TaskResultDeserializer());

        addSerializer(ArtifactRef.class, new ArtifactRefSerializer());
        addDeserializer(ArtifactRef.class, new ArtifactRefDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(RunSnapshot.class, RunSnapshotMixin.class);
        context.setMixInAnnotations(FindingsReport.class, FindingsReportMixin.class);
    }
}
