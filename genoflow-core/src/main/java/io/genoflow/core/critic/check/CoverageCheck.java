package io.genoflow.core.critic.check;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.task.TaskContract;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Entities flowing downstream must come from upstream.
///
/// Each succeeded task whose contract declares an entity output is compared
/// with its nearest succeeded ancestors that declare one too:
/// - entities absent from every such ancestor: `WARNING`
/// - ancestor entities missing downstream, unless the task is a filter step: `WARNING`
/// - entity outputs held as artifact pointers cannot be inspected: `INFO`
public final class CoverageCheck implements ConsistencyCheck {

    public static final String NAME = "coverage";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Finding> check(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (TaskSpec task : context.tasks()) {
            Optional<TaskContract> contract = entityContract(context, task);
            if (contract.isEmpty() || !context.succeeded(task.id())) {
                continue;
            }
            String key = contract.get().entityOutput();
            Object value = context.result(task.id()).orElseThrow().outputs().get(key);
            if (value == null) {
                continue;
            }
            if (Entities.isOpaque(value)) {
                findings.add(
                        Finding.info(
                                NAME,
                                List.of(task.id()),
                                List.of(key),
                                "Entity output of '" + task.id() + "' is an artifact; coverage not checked"));
                continue;
            }
            Optional<Set<String>> downstream = Entities.of(value);
            if (downstream.isEmpty()) {
                continue;
            }

            List<String> ancestors = nearestEntityAncestors(context, task);
            Set<String> upstream = new LinkedHashSet<>();
            boolean comparable = !ancestors.isEmpty();
            for (String ancestor : ancestors) {
                TaskSpec spec = context.task(ancestor).orElseThrow();
                String ancestorKey = entityContract(context, spec).orElseThrow().entityOutput();
                Object ancestorValue =
                        context.result(ancestor).orElseThrow().outputs().get(ancestorKey);
                Optional<Set<String>> ids = Entities.of(ancestorValue);
                if (ids.isEmpty()) {
                    comparable = false;
                    break;
                }
                upstream.addAll(ids.get());
            }
            if (!comparable) {
                continue;
            }

            Set<String> introduced = new LinkedHashSet<>(downstream.get());
            introduced.removeAll(upstream);
            if (!introduced.isEmpty()) {
                findings.add(
                        Finding.warning(
                                NAME,
                                concat(ancestors, task.id()),
                                List.of(key),
                                "Task '"
                                        + task.id()
                                        + "' reports "
                                        + introduced.size()
                                        + " entities not present upstream: "
                                        + Entities.sample(introduced)));
            }

            Set<String> dropped = new LinkedHashSet<>(upstream);
            dropped.removeAll(downstream.get());
            if (!dropped.isEmpty() && !contract.get().filterStep()) {
                findings.add(
                        Finding.warning(
                                NAME,
                                concat(ancestors, task.id()),
                                List.of(key),
                                "Task '"
                                        + task.id()
                                        + "' dropped "
                                        + dropped.size()
                                        + " upstream entities without being a filter step: "
                                        + Entities.sample(dropped)));
            }
        }
        return findings;
    }

    private static Optional<TaskContract> entityContract(CheckContext context, TaskSpec task) {
        return context.contractOf(task).filter(TaskContract::hasEntityOutput);
    }

    /// Walks up `dependsOn` edges, stopping at the first entity-bearing task on
    /// each path. Entity-bearing ancestors that did not succeed end the path
    /// without contributing.
    private static List<String> nearestEntityAncestors(CheckContext context, TaskSpec task) {
        Set<String> found = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(task.dependsOn());
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (!visited.add(id)) {
                continue;
            }
            Optional<TaskSpec> spec = context.task(id);
            if (spec.isEmpty()) {
                continue;
            }
            if (entityContract(context, spec.get()).isPresent()) {
                if (context.succeeded(id)) {
                    found.add(id);
                }
                continue;
            }
            pending.addAll(spec.get().dependsOn());
        }
        List<String> ordered = new ArrayList<>();
        for (TaskSpec candidate : context.tasks()) {
            if (found.contains(candidate.id())) {
                ordered.add(candidate.id());
            }
        }
        return ordered;
    }

    private static List<String> concat(List<String> ancestors, String taskId) {
        List<String> all = new ArrayList<>(ancestors);
        all.add(taskId);
        return all;
    }
}
