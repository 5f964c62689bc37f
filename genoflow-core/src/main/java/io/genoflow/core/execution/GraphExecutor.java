package io.genoflow.core.execution;

import io.genoflow.core.GenoflowConfig;
import io.genoflow.core.exception.ErrorKind;
import io.genoflow.core.exception.PlanValidationException;
import io.genoflow.core.exception.ReferenceResolutionException;
import io.genoflow.core.exception.TaskExecutionException;
import io.genoflow.core.exception.UnresolvedReferenceException;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.PlanValidator;
import io.genoflow.core.plan.TaskGraph;
import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.state.RunSnapshot;
import io.genoflow.core.task.TaskRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes a {@link Plan} in dependency order, dispatching each task to the
/// body registered for its type.
///
/// ### Execution Flow
/// 1. Validate the plan (unknown dependencies, cycles, undeclared references)
/// 2. Seed the result table: succeeded prior results are kept, everything else
///    starts pending
/// 3. Walk eligible tasks (all dependencies succeeded) in topological order,
///    ties broken by declaration order. For each task:
///    - resolve its config against upstream outputs
///    - mark it running and invoke the body with the resolved config and the run context
///    - record the outputs, or the failure
/// 4. On failure, skip every pending task downstream of the failed one; tasks
///    outside that closure keep running
/// 5. Emit a checkpoint after every terminal transition
///
/// ### Halting
/// - **Run timeout**: once elapsed, no further task starts; pending tasks are
///   skipped with reason "run timeout". Running tasks finish on their own
/// - **Stop on error**: the first failure skips every pending task
///
/// In both cases the outcome is {@link RunStatus#HALTED_ON_ERROR}.
///
/// ### Concurrency
/// With `maxConcurrency == 1` tasks run one at a time on the calling thread.
/// Above one, mutually independent eligible tasks run on a fixed pool created
/// for the run and shut down when it ends. Dependencies still happen-before
/// their dependents; the scheduling thread alone decides what starts next.
///
/// The executor never retries a body. Whatever failure the body signals is
/// recorded as-is.
///
/// @implNote Thread-safe. Each invocation owns its {@link RunContext} and
/// result store, so one executor can serve concurrent runs. Listener
/// registration uses a {@link CopyOnWriteArrayList}.
///
/// @see RunListener for lifecycle callbacks
/// @see RunOutcome for the result
public class GraphExecutor {

    private static final Logger logger = Logger.getLogger(GraphExecutor.class.getName());

    private static final String RUN_TIMEOUT_REASON = "run timeout";

    private final TaskRegistry taskRegistry;
    private final ReferenceResolver referenceResolver = new ReferenceResolver();
    private final int maxConcurrency;
    private final Duration runTimeout;
    private final boolean stopOnError;
    private final Clock clock;
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();

    /// Creates a sequential executor without timeout.
    ///
    /// @param taskRegistry registry dispatching task bodies, not null
    public GraphExecutor(TaskRegistry taskRegistry) {
        this(taskRegistry, new GenoflowConfig());
    }

    public GraphExecutor(TaskRegistry taskRegistry, GenoflowConfig config) {
        this(taskRegistry, config, Clock.systemUTC());
    }

    /// Creates an executor.
    ///
    /// @param taskRegistry registry dispatching task bodies, not null
    /// @param config concurrency, timeout and stop-on-error settings, not null
    /// @param clock source of task timestamps and the run deadline, not null
    public GraphExecutor(TaskRegistry taskRegistry, GenoflowConfig config, Clock clock) {
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.maxConcurrency = config.getMaxConcurrency();
        this.runTimeout = config.getRunTimeout();
        this.stopOnError = config.isStopOnError();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Registers a listener receiving events of every run.
    ///
    /// @apiNote **Side effects**: adds to the internal listener list; duplicates are allowed.
    ///
    /// @param listener the listener to add, not null
    public void addListener(RunListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
    }

    public boolean removeListener(RunListener listener) {
        return listeners.remove(listener);
    }

    /// Runs a plan from scratch.
    ///
    /// @param plan the plan, not null
    /// @return outcome with the final result table, never null
    /// @throws PlanValidationException if the plan is structurally invalid; no task runs
    public RunOutcome run(Plan plan) throws PlanValidationException {
        return run(RunRequest.of(plan));
    }

    public RunOutcome run(Plan plan, RunListener listener) throws PlanValidationException {
        return run(RunRequest.of(plan).withListener(listener));
    }

    /// Continues a checkpointed run. Succeeded tasks are not invoked again and
    /// their stored outputs feed reference resolution verbatim.
    ///
    /// @param snapshot last checkpoint, not null
    /// @return outcome of the continued run, never null
    /// @throws PlanValidationException if the snapshot's plan is invalid
    public RunOutcome resume(RunSnapshot snapshot) throws PlanValidationException {
        return run(RunRequest.resume(snapshot));
    }

    /// Runs a plan as described by a request.
    ///
    /// @param request plan, prior results, services and listener, not null
    /// @return outcome with the final result table, never null
    /// @throws PlanValidationException if the plan is structurally invalid; no task runs
    public RunOutcome run(RunRequest request) throws PlanValidationException {
        Objects.requireNonNull(request, "request must not be null");
        TaskGraph graph = PlanValidator.validate(request.plan());
        return new Run(request, graph).execute();
    }

    /// State of one invocation. Fields other than the result store are only
    /// touched by the scheduling thread.
    private final class Run {

        private final Plan plan;
        private final TaskGraph graph;
        private final TaskResultStore store;
        private final RunContext context;
        private final RunListener requestListener;
        private final Instant startedAt;
        private final Instant deadline;

        private String haltReason;
        private ErrorKind haltKind;

        private Run(RunRequest request, TaskGraph graph) {
            this.plan = request.plan();
            this.graph = graph;
            this.requestListener = request.listener();
            this.store = new TaskResultStore(graph.topologicalIds(), seed(request.priorResults()));
            this.context =
                    RunContext.builder()
                            .runId(request.runId() != null ? request.runId() : newRunId())
                            .plan(plan)
                            .results(store)
                            .artifactStore(request.artifactStore())
                            .services(request.services())
                            .build();
            this.startedAt = clock.instant();
            this.deadline = runTimeout != null ? startedAt.plus(runTimeout) : null;
        }

        RunOutcome execute() {
            logger.info(
                    "Starting run "
                            + context.getRunId()
                            + " with "
                            + graph.size()
                            + " tasks"
                            + (maxConcurrency > 1 ? " (concurrency " + maxConcurrency + ")" : ""));
            notifyListeners(l -> l.onRunStart(context));

            if (maxConcurrency == 1) {
                runSequential();
            } else {
                runConcurrent();
            }

            RunOutcome outcome =
                    new RunOutcome(
                            context.getRunId(),
                            overallStatus(),
                            store.snapshot(),
                            haltReason,
                            haltKind,
                            startedAt,
                            clock.instant());
            logger.info(
                    "Run "
                            + outcome.runId()
                            + " finished: "
                            + outcome.status()
                            + " in "
                            + outcome.duration().toMillis()
                            + "ms");
            notifyListeners(l -> l.onRunComplete(outcome));
            return outcome;
        }

        private Map<String, TaskResult> seed(Map<String, TaskResult> priorResults) {
            Map<String, TaskResult> initial = new HashMap<>();
            priorResults.forEach(
                    (taskId, result) -> {
                        if (!graph.contains(taskId)) {
                            logger.warning("Ignoring prior result for unknown task: " + taskId);
                        } else if (result.isSucceeded()) {
                            initial.put(taskId, result);
                        } else if (result.status() != TaskStatus.PENDING) {
                            logger.info(
                                    "Task "
                                            + taskId
                                            + " was "
                                            + result.status()
                                            + " in the previous attempt; it will run again");
                        }
                    });
            return initial;
        }

        private void runSequential() {
            for (TaskSpec task : graph.topologicalOrder()) {
                if (haltReason != null) {
                    break;
                }
                if (store.status(task.id()) != TaskStatus.PENDING) {
                    continue;
                }
                if (deadlineReached()) {
                    halt(ErrorKind.RUN_TIMEOUT, timeoutMessage(), RUN_TIMEOUT_REASON);
                    break;
                }
                if (!dependenciesSucceeded(task)) {
                    skip(task.id(), "upstream task did not succeed");
                    continue;
                }
                executeTask(task).ifPresent(result -> onTerminal(task, result));
            }
        }

        private void runConcurrent() {
            ExecutorService pool =
                    Executors.newFixedThreadPool(maxConcurrency, workerThreads(context.getRunId()));
            CompletionService<Completed> completion = new ExecutorCompletionService<>(pool);
            Set<String> submitted = new HashSet<>();
            int inFlight = 0;
            boolean drained = false;
            try {
                while (true) {
                    if (haltReason == null && deadlineReached()) {
                        halt(ErrorKind.RUN_TIMEOUT, timeoutMessage(), RUN_TIMEOUT_REASON);
                    }
                    if (haltReason == null) {
                        for (TaskSpec task : graph.topologicalOrder()) {
                            if (inFlight >= maxConcurrency) {
                                break;
                            }
                            if (submitted.contains(task.id())
                                    || store.status(task.id()) != TaskStatus.PENDING
                                    || !dependenciesSucceeded(task)) {
                                continue;
                            }
                            submitted.add(task.id());
                            completion.submit(() -> new Completed(task, executeTask(task)));
                            inFlight++;
                        }
                    }
                    if (inFlight == 0) {
                        break;
                    }

                    Future<Completed> done = awaitNext(completion);
                    if (done == null) {
                        halt(ErrorKind.RUN_TIMEOUT, timeoutMessage(), RUN_TIMEOUT_REASON);
                        continue;
                    }
                    inFlight--;
                    Completed completed = completedValue(done);
                    completed.result().ifPresent(result -> onTerminal(completed.task(), result));
                }
                drained = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                halt(null, "Run interrupted", "run interrupted");
            } finally {
                if (drained) {
                    pool.shutdown();
                } else {
                    pool.shutdownNow();
                }
            }
        }

        private Future<Completed> awaitNext(CompletionService<Completed> completion)
                throws InterruptedException {
            if (deadline == null || haltReason != null) {
                return completion.take();
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return null;
            }
            return completion.poll(remaining.toNanos(), TimeUnit.NANOSECONDS);
        }

        private Completed completedValue(Future<Completed> done) throws InterruptedException {
            try {
                return done.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Task worker failed unexpectedly", e.getCause());
            }
        }

        /// Runs one task to a terminal status. Called on the scheduling thread or
        /// on a pool worker.
        ///
        /// @return the terminal result, or empty if the task was skipped before it could start
        private Optional<TaskResult> executeTask(TaskSpec task) {
            String taskId = task.id();

            Map<String, Object> resolvedConfig;
            try {
                resolvedConfig = referenceResolver.resolve(task.config(), context);
            } catch (UnresolvedReferenceException e) {
                logger.severe(
                        "Task " + taskId + " scheduled before its producer succeeded: " + e.getMessage());
                return store.transitionIf(
                        taskId, TaskStatus.PENDING, r -> r.fail(TaskFailure.from(e), clock.instant()));
            } catch (ReferenceResolutionException e) {
                logger.warning("Task " + taskId + " failed to resolve its config: " + e.getMessage());
                return store.transitionIf(
                        taskId, TaskStatus.PENDING, r -> r.fail(TaskFailure.from(e), clock.instant()));
            }

            if (store.transitionIf(taskId, TaskStatus.PENDING, r -> r.start(clock.instant()))
                    .isEmpty()) {
                return Optional.empty();
            }
            notifyListeners(l -> l.onTaskStart(task, context));

            TaskResult result;
            try {
                Map<String, Object> outputs =
                        taskRegistry.invoke(task.type(), resolvedConfig, context);
                result = store.transition(taskId, r -> r.succeed(outputs, clock.instant()));
                logger.info("Task succeeded: " + taskId);
            } catch (TaskExecutionException e) {
                logger.warning(
                        "Task " + taskId + " failed (" + e.getKind() + "): " + e.getMessage());
                result = store.transition(taskId, r -> r.fail(TaskFailure.from(e), clock.instant()));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Task " + taskId + " threw an unexpected exception", e);
                result =
                        store.transition(
                                taskId, r -> r.fail(TaskFailure.unexpected(e), clock.instant()));
            }
            return Optional.of(result);
        }

        private void onTerminal(TaskSpec task, TaskResult result) {
            notifyListeners(l -> l.onTaskComplete(task, result));
            checkpoint("task " + task.id() + " " + result.status().name().toLowerCase());

            if (result.status() == TaskStatus.FAILED) {
                for (String downstream : graph.downstreamOf(task.id())) {
                    skip(downstream, "upstream task " + task.id() + " failed");
                }
                if (stopOnError) {
                    halt(
                            ErrorKind.TASK_ERROR,
                            "Task " + task.id() + " failed and stopOnError is enabled",
                            "run halted after task " + task.id() + " failed");
                }
            }
        }

        private void halt(ErrorKind kind, String reason, String skipReason) {
            if (haltReason != null) {
                return;
            }
            haltReason = reason;
            haltKind = kind;
            logger.warning("Halting run " + context.getRunId() + ": " + reason);
            for (String taskId : graph.topologicalIds()) {
                skip(taskId, skipReason);
            }
        }

        private void skip(String taskId, String reason) {
            store.transitionIf(taskId, TaskStatus.PENDING, r -> r.skip(reason, clock.instant()))
                    .ifPresent(
                            skipped -> {
                                logger.warning("Task skipped: " + taskId + " (" + reason + ")");
                                checkpoint("task " + taskId + " skipped");
                            });
        }

        private void checkpoint(String reason) {
            RunSnapshot snapshot =
                    new RunSnapshot(
                            context.getRunId(), plan, store.snapshot(), clock.instant(), reason);
            notifyListeners(l -> l.onCheckpoint(snapshot));
        }

        private boolean dependenciesSucceeded(TaskSpec task) {
            for (String dependency : task.dependsOn()) {
                if (store.status(dependency) != TaskStatus.SUCCEEDED) {
                    return false;
                }
            }
            return true;
        }

        private boolean deadlineReached() {
            return deadline != null && !clock.instant().isBefore(deadline);
        }

        private String timeoutMessage() {
            return "Run timeout of " + runTimeout + " elapsed";
        }

        private RunStatus overallStatus() {
            if (haltReason != null) {
                return RunStatus.HALTED_ON_ERROR;
            }
            boolean incomplete =
                    store.snapshot().values().stream()
                            .anyMatch(r -> r.status() != TaskStatus.SUCCEEDED);
            return incomplete ? RunStatus.PARTIALLY_FAILED : RunStatus.ALL_SUCCEEDED;
        }

        private void notifyListeners(Consumer<RunListener> event) {
            dispatch(requestListener, event);
            for (RunListener listener : listeners) {
                dispatch(listener, event);
            }
        }

        private void dispatch(RunListener listener, Consumer<RunListener> event) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Run listener failed; continuing run", e);
            }
        }
    }

    private record Completed(TaskSpec task, Optional<TaskResult> result) {}

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }

    private static ThreadFactory workerThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "genoflow-" + runId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
