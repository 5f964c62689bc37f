package io.genoflow.core.critic;

import java.util.List;

/// One independent cross-task invariant evaluated after a run.
///
/// Checks only read; they never change task results. A check that throws is
/// reported by the {@link ConsistencyChecker} as an error finding and the
/// remaining checks still run.
public interface ConsistencyCheck {

    /// Returns the name stamped on this check's findings.
    ///
    /// @return kebab-case name, never null
    String name();

    /// Evaluates the check.
    ///
    /// @param context plan, results and contracts of the run, not null
    /// @return findings in plan order, never null
    List<Finding> check(CheckContext context);
}
