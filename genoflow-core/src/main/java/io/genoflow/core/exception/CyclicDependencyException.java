package io.genoflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when the dependency relation of a plan is not acyclic.
///
/// Carries the ids of the tasks that could not be ordered, i.e. the tasks on
/// a cycle or downstream of one.
public class CyclicDependencyException extends PlanValidationException {

    @Serial private static final long serialVersionUID = -1598232452707355413L;

    private final List<String> unorderedTaskIds;

    public CyclicDependencyException(List<String> unorderedTaskIds) {
        super(
                ErrorKind.CYCLIC_DEPENDENCY,
                "Dependency cycle detected among tasks: " + unorderedTaskIds);
        this.unorderedTaskIds = List.copyOf(unorderedTaskIds);
    }

    /// Returns the tasks left over after topological ordering stalled.
    ///
    /// @return task ids in declaration order, never null
    public List<String> getUnorderedTaskIds() {
        return unorderedTaskIds;
    }
}
