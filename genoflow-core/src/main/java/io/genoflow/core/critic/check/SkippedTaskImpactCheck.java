package io.genoflow.core.critic.check;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.execution.TaskStatus;
import io.genoflow.core.plan.OutputReference;
import io.genoflow.core.plan.TaskSpec;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// A skipped task must not have fed a task that succeeded.
///
/// A succeeded consumer either depends on the skipped task or references one of
/// its outputs. Under dependency-ordered execution neither can happen, so any
/// occurrence is an `ERROR`.
public final class SkippedTaskImpactCheck implements ConsistencyCheck {

    public static final String NAME = "skipped-task-impact";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Finding> check(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (TaskSpec consumer : context.tasks()) {
            if (!context.succeeded(consumer.id())) {
                continue;
            }
            Set<String> producers = new LinkedHashSet<>(consumer.dependsOn());
            Set<String> referencedKeys = new LinkedHashSet<>();
            for (OutputReference ref : consumer.references()) {
                producers.add(ref.taskId());
            }
            for (String producer : producers) {
                if (context.status(producer) != TaskStatus.SKIPPED) {
                    continue;
                }
                referencedKeys.clear();
                for (OutputReference ref : consumer.references()) {
                    if (ref.taskId().equals(producer)) {
                        referencedKeys.add(ref.outputKey());
                    }
                }
                findings.add(
                        Finding.error(
                                NAME,
                                List.of(producer, consumer.id()),
                                List.copyOf(referencedKeys),
                                "Task '"
                                        + consumer.id()
                                        + "' succeeded although its input task '"
                                        + producer
                                        + "' was skipped"));
            }
        }
        return findings;
    }
}
