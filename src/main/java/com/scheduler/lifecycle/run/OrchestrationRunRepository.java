package com.scheduler.lifecycle.run;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for orchestration runs.
 * The two write operations are atomic and form the basis of the single-flight guard
 * and of every state transition.
 */
public interface OrchestrationRunRepository {

    /**
     * Stores a new run only if no run is currently QUEUED or RUNNING.
     *
     * @return true if the run was stored, false if another run is active
     */
    boolean insertIfNoneActive(OrchestrationRun run);

    /**
     * Replaces the stored run with {@code updated} if the stored status equals {@code expectedStatus}
     * and the stored version equals {@code expectedVersion}.
     *
     * @return true if the swap happened
     */
    boolean compareAndSet(OrchestrationRun updated, RunStatus expectedStatus, long expectedVersion);

    Optional<OrchestrationRun> findById(String requestId);

    /**
     * Returns the most recently requested run.
     */
    Optional<OrchestrationRun> findLatest();

    /**
     * Returns the COMPLETED run with the latest completion time.
     */
    Optional<OrchestrationRun> findLatestCompleted();

    /**
     * Returns QUEUED and RUNNING runs, most recently requested first.
     */
    List<OrchestrationRun> findActive();

    /**
     * Returns up to {@code limit} runs, most recently requested first.
     */
    List<OrchestrationRun> findRecent(int limit);
}
