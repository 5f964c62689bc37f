package io.genoflow.core.critic.check;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.task.TaskContract;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// A succeeded task should produce every output key its contract guarantees.
/// Each missing key is a `WARNING`.
public final class DeclaredOutputsCheck implements ConsistencyCheck {

    public static final String NAME = "declared-outputs";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Finding> check(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (TaskSpec task : context.tasks()) {
            if (!context.succeeded(task.id())) {
                continue;
            }
            TaskContract contract = context.contractOf(task).orElse(null);
            if (contract == null) {
                continue;
            }
            Map<String, Object> outputs = context.result(task.id()).orElseThrow().outputs();
            for (String key : contract.outputs()) {
                if (!outputs.containsKey(key)) {
                    findings.add(
                            Finding.warning(
                                    NAME,
                                    List.of(task.id()),
                                    List.of(key),
                                    "Task '"
                                            + task.id()
                                            + "' of type '"
                                            + task.type()
                                            + "' did not produce guaranteed output '"
                                            + key
                                            + "'"));
                }
            }
        }
        return findings;
    }
}
