package io.genoflow.core.critic;

import io.genoflow.core.critic.check.CoverageCheck;
import io.genoflow.core.critic.check.DeclaredOutputsCheck;
import io.genoflow.core.critic.check.EvidenceConsistencyCheck;
import io.genoflow.core.critic.check.PopulationFrequencyCheck;
import io.genoflow.core.critic.check.ReferentialCompletenessCheck;
import io.genoflow.core.critic.check.SkippedTaskImpactCheck;
import io.genoflow.core.critic.check.ValueRangeCheck;
import io.genoflow.core.execution.RunOutcome;
import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.state.RunSnapshot;
import io.genoflow.core.task.TaskRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Re-reads the outputs of a finished run and checks cross-task invariants.
///
/// ### Default checks, in report order
/// 1. {@link ReferentialCompletenessCheck}
/// 2. {@link CoverageCheck}
/// 3. {@link ValueRangeCheck}
/// 4. {@link SkippedTaskImpactCheck}
/// 5. {@link DeclaredOutputsCheck}
/// 6. {@link PopulationFrequencyCheck}
/// 7. {@link EvidenceConsistencyCheck}
///
/// Individual default checks can be switched off by name, see
/// {@link #defaultChecks(Collection)}.
///
/// Every check runs regardless of what earlier ones found. A check that throws
/// becomes an `ERROR` finding carrying its name. A run in which no task
/// completed gets a report with a single `WARNING` and no further checks.
/// The checker never raises for a well-formed call and never mutates results.
///
/// ### Usage
/// {@snippet :
/// RunOutcome outcome = executor.run(plan);
/// FindingsReport report = new ConsistencyChecker(registry).check(plan, outcome);
/// if (report.status() == ReportStatus.FAIL) {
///     // inspect report.withSeverity(Severity.ERROR)
/// }
/// }
///
/// @implNote Thread-safe if the supplied checks are.
public class ConsistencyChecker {

    private static final Logger logger = Logger.getLogger(ConsistencyChecker.class.getName());

    /// Check name used for the finding emitted when no task completed.
    public static final String RUN_CHECK = "run";

    private final TaskRegistry taskRegistry;
    private final List<ConsistencyCheck> checks;
    private final Clock clock;

    /// Creates a checker with the default checks.
    ///
    /// @param taskRegistry source of task contracts, not null
    public ConsistencyChecker(TaskRegistry taskRegistry) {
        this(taskRegistry, defaultChecks(), Clock.systemUTC());
    }

    /// Creates a checker with custom checks.
    ///
    /// @param taskRegistry source of task contracts, not null
    /// @param checks checks in report order, not null
    /// @param clock source of report timestamps, not null
    public ConsistencyChecker(TaskRegistry taskRegistry, List<ConsistencyCheck> checks, Clock clock) {
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Returns a fresh list of the built-in checks.
    ///
    /// @return default checks in report order, never null
    public static List<ConsistencyCheck> defaultChecks() {
        return List.of(
                new ReferentialCompletenessCheck(),
                new CoverageCheck(),
                new ValueRangeCheck(),
                new SkippedTaskImpactCheck(),
                new DeclaredOutputsCheck(),
                new PopulationFrequencyCheck(),
                new EvidenceConsistencyCheck());
    }

    /// Returns the built-in checks minus the disabled ones.
    ///
    /// @param disabled names of checks to leave out, not null
    /// @return remaining default checks in report order, never null
    /// @throws IllegalArgumentException if a name matches no default check
    public static List<ConsistencyCheck> defaultChecks(Collection<String> disabled) {
        Objects.requireNonNull(disabled, "disabled must not be null");
        List<ConsistencyCheck> all = defaultChecks();
        TreeSet<String> unknown = new TreeSet<>(disabled);
        all.forEach(check -> unknown.remove(check.name()));
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown consistency checks: " + unknown);
        }
        return all.stream().filter(check -> !disabled.contains(check.name())).toList();
    }

    /// Checks a plan against its results.
    ///
    /// @param plan the executed plan, not null
    /// @param results final result per task id, not null
    /// @return findings report, never null
    public FindingsReport check(Plan plan, Map<String, TaskResult> results) {
        CheckContext context = new CheckContext(plan, results, taskRegistry);

        if (!context.hasCompletedTasks()) {
            logger.warning("No completed tasks to check");
            return new FindingsReport(
                    List.of(
                            Finding.warning(
                                    RUN_CHECK,
                                    List.of(),
                                    List.of(),
                                    "No task completed; consistency checks were not run")),
                    clock.instant());
        }

        List<Finding> findings = new ArrayList<>();
        for (ConsistencyCheck check : checks) {
            try {
                findings.addAll(check.check(context));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Consistency check '" + check.name() + "' failed", e);
                findings.add(
                        Finding.error(
                                check.name(),
                                List.of(),
                                List.of(),
                                "Check failed with "
                                        + e.getClass().getSimpleName()
                                        + ": "
                                        + e.getMessage()));
            }
        }

        FindingsReport report = new FindingsReport(findings, clock.instant());
        logger.info(
                "Consistency check finished: "
                        + report.status()
                        + " ("
                        + report.count(Severity.ERROR)
                        + " errors, "
                        + report.count(Severity.WARNING)
                        + " warnings, "
                        + report.count(Severity.INFO)
                        + " info)");
        return report;
    }

    public FindingsReport check(Plan plan, RunOutcome outcome) {
        return check(plan, outcome.results());
    }

    public FindingsReport check(RunSnapshot snapshot) {
        return check(snapshot.plan(), snapshot.results());
    }
}
