package io.genoflow.core.critic.check;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.plan.OutputReference;
import io.genoflow.core.plan.TaskSpec;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Every output reference in the plan must point at a present, non-null value.
///
/// - producer succeeded, key absent or null: `ERROR` naming producer, consumer and key
/// - producer did not succeed: one `INFO` per reference, since the executor
///   already skipped or failed the consumer
///
/// A reference appearing several times in one consumer's config is reported once.
public final class ReferentialCompletenessCheck implements ConsistencyCheck {

    public static final String NAME = "referential-completeness";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Finding> check(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (TaskSpec consumer : context.tasks()) {
            Set<OutputReference> references = new LinkedHashSet<>(consumer.references());
            for (OutputReference ref : references) {
                String producer = ref.taskId();
                List<String> tasks = List.of(producer, consumer.id());
                List<String> keys = List.of(ref.outputKey());

                if (!context.succeeded(producer)) {
                    findings.add(
                            Finding.info(
                                    NAME,
                                    tasks,
                                    keys,
                                    "Task '"
                                            + consumer.id()
                                            + "' references "
                                            + ref.expression()
                                            + " but '"
                                            + producer
                                            + "' is "
                                            + context.status(producer)));
                    continue;
                }

                TaskResult result = context.result(producer).orElseThrow();
                if (!result.outputs().containsKey(ref.outputKey())) {
                    findings.add(
                            Finding.error(
                                    NAME,
                                    tasks,
                                    keys,
                                    "Task '"
                                            + consumer.id()
                                            + "' requires output '"
                                            + ref.outputKey()
                                            + "' of task '"
                                            + producer
                                            + "', which it did not produce"));
                } else if (result.outputs().get(ref.outputKey()) == null) {
                    findings.add(
                            Finding.error(
                                    NAME,
                                    tasks,
                                    keys,
                                    "Task '"
                                            + consumer.id()
                                            + "' requires output '"
                                            + ref.outputKey()
                                            + "' of task '"
                                            + producer
                                            + "', which is null"));
                }
            }
        }
        return findings;
    }
}
