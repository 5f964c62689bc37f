package io.genoflow.core.critic.check;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.task.TaskContract;
import io.genoflow.core.task.ValueRange;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Numeric outputs must fall within the range their contract declares.
///
/// Scalars are checked directly, collections element by element and maps of
/// entity → number value by value. One `WARNING` per offending key lists a
/// sample of violations; a non-numeric value under a ranged key is a
/// separate `WARNING`. Keys absent from the outputs are left to
/// {@link DeclaredOutputsCheck}.
public final class ValueRangeCheck implements ConsistencyCheck {

    public static final String NAME = "value-range";

    private static final int SAMPLE_SIZE = 5;

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
            if (contract == null || contract.ranges().isEmpty()) {
                continue;
            }
            Map<String, Object> outputs = context.result(task.id()).orElseThrow().outputs();
            for (Map.Entry<String, ValueRange> entry : contract.ranges().entrySet()) {
                String key = entry.getKey();
                if (!outputs.containsKey(key) || outputs.get(key) == null) {
                    continue;
                }
                Map<String, Object> values = flatten(key, outputs.get(key));
                checkValues(task.id(), key, entry.getValue(), values, findings);
            }
        }
        return findings;
    }

    private static void checkValues(
            String taskId,
            String key,
            ValueRange range,
            Map<String, Object> values,
            List<Finding> findings) {
        List<String> outOfRange = new ArrayList<>();
        List<String> nonNumeric = new ArrayList<>();
        values.forEach(
                (label, value) -> {
                    if (value instanceof Number number) {
                        double d = number.doubleValue();
                        if (Double.isNaN(d) || !range.contains(d)) {
                            outOfRange.add(label + "=" + value);
                        }
                    } else {
                        nonNumeric.add(label + "=" + value);
                    }
                });

        if (!outOfRange.isEmpty()) {
            findings.add(
                    Finding.warning(
                            NAME,
                            List.of(taskId),
                            List.of(key),
                            "Output '"
                                    + key
                                    + "' of task '"
                                    + taskId
                                    + "' has "
                                    + outOfRange.size()
                                    + " value(s) outside "
                                    + range
                                    + ": "
                                    + sample(outOfRange)));
        }
        if (!nonNumeric.isEmpty()) {
            findings.add(
                    Finding.warning(
                            NAME,
                            List.of(taskId),
                            List.of(key),
                            "Output '"
                                    + key
                                    + "' of task '"
                                    + taskId
                                    + "' has non-numeric value(s) where "
                                    + range
                                    + " is expected: "
                                    + sample(nonNumeric)));
        }
    }

    /// Labels every checked value: the key itself for scalars, `key[i]` for
    /// list elements and `key.entity` for map entries.
    private static Map<String, Object> flatten(String key, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((entity, v) -> values.put(key + "." + entity, v));
        } else if (value instanceof Collection<?> collection) {
            int i = 0;
            for (Object item : collection) {
                values.put(key + "[" + i++ + "]", item);
            }
        } else {
            values.put(key, value);
        }
        return values;
    }

    private static String sample(List<String> items) {
        String shown = String.join(", ", items.subList(0, Math.min(SAMPLE_SIZE, items.size())));
        return items.size() > SAMPLE_SIZE ? shown + ", ..." : shown;
    }
}
