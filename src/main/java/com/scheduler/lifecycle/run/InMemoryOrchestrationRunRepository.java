package com.scheduler.lifecycle.run;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link OrchestrationRunRepository}.
 * Suitable for testing and single-JVM deployments; the guard does not survive a restart.
 */
public class InMemoryOrchestrationRunRepository implements OrchestrationRunRepository {

    private static final Comparator<OrchestrationRun> NEWEST_FIRST =
            Comparator.comparing(OrchestrationRun::requestedAt).reversed();

    private final Map<String, OrchestrationRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized boolean insertIfNoneActive(OrchestrationRun run) {
        if (runs.values().stream().anyMatch(OrchestrationRun::isActive)) {
            return false;
        }
        runs.put(run.requestId(), run);
        return true;
    }

    @Override
    public synchronized boolean compareAndSet(OrchestrationRun updated, RunStatus expectedStatus,
                                              long expectedVersion) {
        OrchestrationRun current = runs.get(updated.requestId());
        if (current == null || current.status() != expectedStatus || current.version() != expectedVersion) {
            return false;
        }
        runs.put(updated.requestId(), updated);
        return true;
    }

    @Override
    public synchronized Optional<OrchestrationRun> findById(String requestId) {
        return Optional.ofNullable(runs.get(requestId));
    }

    @Override
    public synchronized Optional<OrchestrationRun> findLatest() {
        return runs.values().stream().min(NEWEST_FIRST);
    }

    @Override
    public synchronized Optional<OrchestrationRun> findLatestCompleted() {
        return runs.values().stream()
                .filter(r -> r.status() == RunStatus.COMPLETED)
                .max(Comparator.comparing(OrchestrationRun::completedAt));
    }

    @Override
    public synchronized List<OrchestrationRun> findActive() {
        return runs.values().stream()
                .filter(OrchestrationRun::isActive)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public synchronized List<OrchestrationRun> findRecent(int limit) {
        return runs.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    /**
     * Stores a run unconditionally. Used to seed history.
     */
    public synchronized void save(OrchestrationRun run) {
        runs.put(run.requestId(), run);
    }
}
