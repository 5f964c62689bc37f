package io.genoflow.core.task;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link TaskRegistry}.
///
/// @implNote Thread-safe. Registrations may happen while runs are in flight;
/// a run sees whichever body is registered at the moment a task is dispatched.
public final class DefaultTaskRegistry implements TaskRegistry {

    private static final Logger logger = Logger.getLogger(DefaultTaskRegistry.class.getName());

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    @Override
    public void register(TaskContract contract, TaskBody body) {
        Objects.requireNonNull(contract, "contract must not be null");
        Objects.requireNonNull(body, "body must not be null");

        Registration previous = registrations.put(contract.type(), new Registration(contract, body));
        if (previous != null) {
            logger.warning("Task type already registered: " + contract.type() + ". Replacing...");
        } else {
            logger.fine("Registered task type: " + contract.type());
        }
    }

    @Override
    public Optional<TaskBody> getBody(String type) {
        Objects.requireNonNull(type, "type must not be null");
        Registration registration = registrations.get(type);
        return registration != null ? Optional.of(registration.body()) : Optional.empty();
    }

    @Override
    public Optional<TaskContract> getContract(String type) {
        Objects.requireNonNull(type, "type must not be null");
        Registration registration = registrations.get(type);
        return registration != null ? Optional.of(registration.contract()) : Optional.empty();
    }

    @Override
    public boolean contains(String type) {
        Objects.requireNonNull(type, "type must not be null");
        return registrations.containsKey(type);
    }

    @Override
    public Set<String> types() {
        return Set.copyOf(registrations.keySet());
    }

    /// Removes a registration.
    ///
    /// @param type task-type identifier, not null
    /// @return true if a registration was removed
    public boolean unregister(String type) {
        Objects.requireNonNull(type, "type must not be null");
        return registrations.remove(type) != null;
    }

    private record Registration(TaskContract contract, TaskBody body) {}
}
