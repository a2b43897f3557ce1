package ledger.store;

import ledger.model.ProjectionState;
import ledger.spi.ProjectionStateStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link ProjectionStateStore}.
 */
public final class InMemoryProjectionStateStore implements ProjectionStateStore {
    private final Map<String, ProjectionState> states = new ConcurrentHashMap<>();

    @Override
    public ProjectionState register(String projectionName) {
        return states.computeIfAbsent(projectionName, ProjectionState::initial);
    }

    @Override
    public Optional<ProjectionState> find(String projectionName) {
        return Optional.ofNullable(states.get(projectionName));
    }

    @Override
    public List<ProjectionState> findAll() {
        List<ProjectionState> all = new ArrayList<>(states.values());
        all.sort(Comparator.comparing(ProjectionState::projectionName));
        return all;
    }

    @Override
    public void saveCheckpoint(String projectionName, long eventNumber, Instant processedAt) {
        update(projectionName, state -> state.withCheckpoint(eventNumber, processedAt));
    }

    @Override
    public void recordFailure(String projectionName, String error) {
        update(projectionName, state -> state.withFailure(error));
    }

    @Override
    public void markRunning(String projectionName, boolean running) {
        update(projectionName, state -> state.withRunning(running));
    }

    @Override
    public void reset(String projectionName) {
        update(projectionName, state -> ProjectionState.initial(projectionName));
    }

    private void update(String projectionName, UnaryOperator<ProjectionState> change) {
        ProjectionState updated = states.computeIfPresent(projectionName, (name, state) -> change.apply(state));
        if (updated == null) {
            throw new IllegalStateException("Projection " + projectionName + " is not registered");
        }
    }
}
