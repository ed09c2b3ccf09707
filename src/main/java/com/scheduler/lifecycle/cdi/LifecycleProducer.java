package com.scheduler.lifecycle.cdi;

import com.scheduler.lifecycle.analytics.ConcurrencyWindowAnalyzer;
import com.scheduler.lifecycle.analytics.ExecutionIntervalSource;
import com.scheduler.lifecycle.analytics.GraphExecutionIntervalSource;
import com.scheduler.lifecycle.analytics.TieBreak;
import com.scheduler.lifecycle.archival.ArchivalBatcher;
import com.scheduler.lifecycle.archival.ArchivePurger;
import com.scheduler.lifecycle.graph.FalkorDBConnection;
import com.scheduler.lifecycle.graph.GraphConnection;
import com.scheduler.lifecycle.health.FalkorDBHealthCheck;
import com.scheduler.lifecycle.health.HealthCheckRegistry;
import com.scheduler.lifecycle.health.OrchestrationHealthCheck;
import com.scheduler.lifecycle.lock.GraphRunLock;
import com.scheduler.lifecycle.lock.LocalRunLock;
import com.scheduler.lifecycle.lock.RunLock;
import com.scheduler.lifecycle.logfiles.LogFileReaper;
import com.scheduler.lifecycle.maintenance.MaintenanceOrchestrator;
import com.scheduler.lifecycle.maintenance.MaintenanceScheduler;
import com.scheduler.lifecycle.metrics.MetricsService;
import com.scheduler.lifecycle.metrics.MicrometerMetricsService;
import com.scheduler.lifecycle.metrics.NoOpMetricsService;
import com.scheduler.lifecycle.retention.MicroProfileRetentionPolicyProvider;
import com.scheduler.lifecycle.retention.RetentionPolicyProvider;
import com.scheduler.lifecycle.run.GraphOrchestrationRunRepository;
import com.scheduler.lifecycle.run.OrchestrationRunRepository;
import com.scheduler.lifecycle.run.RunStateTracker;
import com.scheduler.lifecycle.store.ArchiveStore;
import com.scheduler.lifecycle.store.GraphArchiveStore;
import com.scheduler.lifecycle.store.GraphOperationalStore;
import com.scheduler.lifecycle.store.OperationalStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * CDI producer that wires the data-lifecycle engine from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * scheduler-lifecycle:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: scheduler
 *   maintenance:
 *     daily-hour-utc: 2
 *     scheduler-enabled: true
 *   lock:
 *     mode: local            # or graph, for several instances sharing one graph
 *   health:
 *     max-hours-since-last-run: 26
 *   orchestration:
 *     abandon-after: PT12H
 *   analytics:
 *     tie-break: END_BEFORE_START
 * </pre>
 *
 * <p>Retention settings are not injected here: {@link MicroProfileRetentionPolicyProvider}
 * reads them from {@link Config} at the start of every maintenance run.</p>
 */
@ApplicationScoped
public class LifecycleProducer {

    private static final Logger log = LoggerFactory.getLogger(LifecycleProducer.class);

    @Inject
    Config config;

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.falkordb.graph-name", defaultValue = "scheduler")
    String falkordbGraphName;

    // ── Maintenance ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.maintenance.daily-hour-utc", defaultValue = "2")
    int dailyHourUtc;

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.maintenance.scheduler-enabled", defaultValue = "true")
    boolean schedulerEnabled;

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.lock.mode", defaultValue = "local")
    String lockMode;

    // ── Orchestration / health ────────────────────────────────

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.health.max-hours-since-last-run", defaultValue = "26")
    int maxHoursSinceLastRun;

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.orchestration.abandon-after", defaultValue = "PT12H")
    String abandonAfter;

    @Inject
    @ConfigProperty(name = "scheduler-lifecycle.analytics.tie-break", defaultValue = "END_BEFORE_START")
    String tieBreak;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        log.info("Producing GraphConnection: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        FalkorDBConnection connection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
        connection.createIndexes();
        return connection;
    }

    public void closeConnection(@Disposes GraphConnection connection) {
        log.info("Closing GraphConnection");
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public RetentionPolicyProvider retentionPolicyProvider() {
        return new MicroProfileRetentionPolicyProvider(config);
    }

    @Produces
    @ApplicationScoped
    public OperationalStore operationalStore(GraphConnection connection) {
        return new GraphOperationalStore(connection);
    }

    @Produces
    @ApplicationScoped
    public ArchiveStore archiveStore(GraphConnection connection) {
        return new GraphArchiveStore(connection);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry.isResolvable()) {
            log.info("Micrometer metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("No MeterRegistry available, metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public RunLock runLock(GraphConnection connection) {
        if ("graph".equalsIgnoreCase(lockMode)) {
            log.info("Using graph run lock");
            return new GraphRunLock(connection);
        }
        if (!"local".equalsIgnoreCase(lockMode)) {
            log.warn("Unknown lock mode '{}', falling back to local", lockMode);
        }
        return new LocalRunLock();
    }

    @Produces
    @ApplicationScoped
    public MaintenanceOrchestrator maintenanceOrchestrator(RetentionPolicyProvider policyProvider,
                                                           OperationalStore operationalStore,
                                                           ArchiveStore archiveStore,
                                                           RunLock runLock,
                                                           MetricsService metricsService) {
        return new MaintenanceOrchestrator(policyProvider,
                new ArchivalBatcher(operationalStore, archiveStore),
                new ArchivePurger(archiveStore),
                new LogFileReaper(),
                runLock,
                metricsService,
                Clock.systemUTC());
    }

    @Produces
    @ApplicationScoped
    public MaintenanceScheduler maintenanceScheduler(MaintenanceOrchestrator orchestrator) {
        return new MaintenanceScheduler(orchestrator, dailyHourUtc, Clock.systemUTC());
    }

    public void closeScheduler(@Disposes MaintenanceScheduler scheduler) {
        scheduler.close();
    }

    @Produces
    @ApplicationScoped
    public OrchestrationRunRepository orchestrationRunRepository(GraphConnection connection) {
        return new GraphOrchestrationRunRepository(connection);
    }

    @Produces
    @ApplicationScoped
    public RunStateTracker runStateTracker(OrchestrationRunRepository repository, MetricsService metricsService) {
        return new RunStateTracker(repository, metricsService, Clock.systemUTC());
    }

    @Produces
    @ApplicationScoped
    public OrchestrationHealthCheck orchestrationHealthCheck(OrchestrationRunRepository repository) {
        return new OrchestrationHealthCheck(repository, Duration.ofHours(maxHoursSinceLastRun), Clock.systemUTC());
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(GraphConnection connection,
                                                   OrchestrationHealthCheck orchestrationHealthCheck) {
        return new HealthCheckRegistry()
                .register(new FalkorDBHealthCheck(connection))
                .register(orchestrationHealthCheck);
    }

    @Produces
    @ApplicationScoped
    public ExecutionIntervalSource executionIntervalSource(GraphConnection connection) {
        return new GraphExecutionIntervalSource(connection);
    }

    @Produces
    @ApplicationScoped
    public ConcurrencyWindowAnalyzer concurrencyWindowAnalyzer() {
        return new ConcurrencyWindowAnalyzer(TieBreak.valueOf(tieBreak.trim().toUpperCase(Locale.ROOT)));
    }

    // ══════════════════════════════════════════════════════════
    //  Startup
    // ══════════════════════════════════════════════════════════

    void onStartup(@Observes @Initialized(ApplicationScoped.class) Object event,
                   RunStateTracker tracker,
                   MaintenanceScheduler scheduler) {
        int recovered = tracker.recoverAbandoned(Duration.parse(abandonAfter));
        log.info("Startup recovery complete: {} abandoned orchestration run(s) failed", recovered);
        if (schedulerEnabled) {
            scheduler.start();
        } else {
            log.info("Maintenance scheduler disabled");
        }
    }
}
