package com.trust.network.pipeline;

import com.trust.network.config.OptimizationConfig;
import com.trust.network.config.SentinelGroupSource;
import com.trust.network.core.model.EndorsementRecord;
import com.trust.network.core.model.IdentityMetadata;
import com.trust.network.export.ExportResult;
import com.trust.network.export.ResultExporter;
import com.trust.network.export.VisualizationOptions;
import com.trust.network.graph.NetworkBuilder;
import com.trust.network.graph.NetworkOptions;
import com.trust.network.graph.NetworkSnapshot;
import com.trust.network.ingest.EndorsementCsvReader;
import com.trust.network.ingest.IdentityCsvReader;
import com.trust.network.ingest.ProgressCallback;
import com.trust.network.logging.LogContext;
import com.trust.network.maintenance.MaintenanceSelection;
import com.trust.network.maintenance.MaintenanceSelector;
import com.trust.network.metrics.MetricsService;
import com.trust.network.metrics.NoOpMetricsService;
import com.trust.network.selection.RoleAssignment;
import com.trust.network.selection.SelectionResult;
import com.trust.network.sentinel.SentinelSelection;
import com.trust.network.sentinel.SentinelSelector;
import com.trust.network.solver.IntegerProgramSolver;
import com.trust.network.solver.OrToolsMipSolver;
import com.trust.network.solver.TimeBoundedSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs one batch optimization: build the snapshot, select sentinels and maintenance
 * contacts, derive node roles, export the artifacts.
 *
 * <p>Both selectors read the same immutable snapshot. With parallel selectors enabled
 * they run on a two-thread executor, otherwise one after the other; results are the
 * same either way.</p>
 *
 * <pre>
 * try (OptimizationPipeline pipeline = OptimizationPipeline.builder()
 *         .config(OptimizationConfig.defaults())
 *         .outputDirectory(Path.of("results"))
 *         .build()) {
 *     PipelineResult result = pipeline.run(Path.of("soc-sign-bitcoinalpha.csv"), Path.of("people.csv"));
 * }
 * </pre>
 */
public class OptimizationPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OptimizationPipeline.class);
    private static final Duration SOLVER_GRACE = Duration.ofSeconds(5);

    private final OptimizationConfig config;
    private final NetworkOptions networkOptions;
    private final IntegerProgramSolver solver;
    private final boolean ownsSolver;
    private final MetricsService metrics;
    private final ResultExporter exporter;
    private final Path outputDirectory;
    private final ProgressCallback progressCallback;
    private final ExecutorService executor;

    private OptimizationPipeline(Builder builder) {
        this.config = builder.config;
        this.networkOptions = builder.networkOptions;
        this.ownsSolver = builder.solver == null;
        this.solver = ownsSolver ? new TimeBoundedSolver(new OrToolsMipSolver(), SOLVER_GRACE) : builder.solver;
        this.metrics = builder.metrics;
        this.exporter = new ResultExporter(config, builder.visualizationOptions);
        this.outputDirectory = builder.outputDirectory;
        this.progressCallback = builder.progressCallback;
        this.executor = config.isParallelSelectors() ? Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "optimizer-selector");
            thread.setDaemon(true);
            return thread;
        }) : null;
    }

    /**
     * Reads the endorsement table and, when given, the identity table, then runs.
     *
     * @param endorsements CSV of {@code source,target,rating,timestamp}
     * @param identities   people CSV keyed by {@code Index}; may be null
     * @throws IOException if either file cannot be read
     */
    public PipelineResult run(Path endorsements, Path identities) throws IOException {
        List<EndorsementRecord> records = new EndorsementCsvReader().read(endorsements);
        Map<Long, IdentityMetadata> metadata = identities != null
                ? new IdentityCsvReader().read(identities)
                : Map.of();
        return run(records, metadata);
    }

    public PipelineResult run(Iterable<EndorsementRecord> records, Map<Long, IdentityMetadata> identities) {
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forRun(runId)) {
            long started = System.currentTimeMillis();
            log.info("pipeline.start config={}", config);

            NetworkSnapshot snapshot = new NetworkBuilder(networkOptions).build(records, identities, progressCallback);
            metrics.recordNetworkSize(snapshot.nodeCount(), snapshot.edgeCount());
            metrics.incrementSkippedRecords(snapshot.buildReport().skippedCount());

            PipelineResult result = run(runId, snapshot);
            log.info("pipeline.completed durationMs={} sentinels={} maintenance={} exported={}",
                    System.currentTimeMillis() - started, result.sentinels().exact().size(),
                    result.maintenance().exact().size(), result.export().isPresent());
            return result;
        }
    }

    /**
     * Runs selection, role assignment and export on an existing snapshot.
     */
    public PipelineResult run(NetworkSnapshot snapshot) {
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forRun(runId)) {
            return run(runId, snapshot);
        }
    }

    private PipelineResult run(String runId, NetworkSnapshot snapshot) {
        SentinelSelector sentinelSelector = new SentinelSelector(config, solver, metrics);
        MaintenanceSelector maintenanceSelector = new MaintenanceSelector(config, solver, metrics);

        SentinelSelection sentinels;
        MaintenanceSelection maintenance;
        if (executor != null) {
            CompletableFuture<SentinelSelection> sentinelFuture =
                    CompletableFuture.supplyAsync(inRun(runId, () -> sentinelSelector.select(snapshot)), executor);
            CompletableFuture<MaintenanceSelection> maintenanceFuture =
                    CompletableFuture.supplyAsync(inRun(runId, () -> maintenanceSelector.select(snapshot)), executor);
            sentinels = join(sentinelFuture);
            maintenance = join(maintenanceFuture);
        } else {
            sentinels = sentinelSelector.select(snapshot);
            maintenance = maintenanceSelector.select(snapshot);
        }

        SelectionResult productionSentinels = config.getSentinelGroupSource() == SentinelGroupSource.GREEDY
                ? sentinels.greedy()
                : sentinels.exact();
        RoleAssignment roles = RoleAssignment.of(productionSentinels, maintenance.exact());

        Optional<ExportResult> export = outputDirectory == null
                ? Optional.empty()
                : Optional.of(exporter.export(runId, snapshot, sentinels, maintenance, roles, outputDirectory));
        return new PipelineResult(runId, snapshot, sentinels, maintenance, roles, export);
    }

    private static <T> Supplier<T> inRun(String runId, Supplier<T> task) {
        return () -> {
            try (LogContext ignored = LogContext.forRun(runId)) {
                return task.get();
            }
        };
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public OptimizationConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (ownsSolver && solver instanceof TimeBoundedSolver timeBounded) {
            timeBounded.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private OptimizationConfig config = OptimizationConfig.defaults();
        private NetworkOptions networkOptions = NetworkOptions.defaults();
        private IntegerProgramSolver solver;
        private MetricsService metrics = new NoOpMetricsService();
        private VisualizationOptions visualizationOptions = VisualizationOptions.defaults();
        private Path outputDirectory;
        private ProgressCallback progressCallback = ProgressCallback.NOOP;

        public Builder config(OptimizationConfig config) {
            this.config = config;
            return this;
        }

        public Builder networkOptions(NetworkOptions networkOptions) {
            this.networkOptions = networkOptions;
            return this;
        }

        /**
         * Backend for the exact methods. Defaults to OR-Tools with SCIP run under the
         * configured time limit. A supplied solver is not closed by the pipeline.
         */
        public Builder solver(IntegerProgramSolver solver) {
            this.solver = solver;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder visualizationOptions(VisualizationOptions visualizationOptions) {
            this.visualizationOptions = visualizationOptions;
            return this;
        }

        /**
         * Where the artifacts go. Without one the run skips export.
         */
        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public OptimizationPipeline build() {
            if (config == null || networkOptions == null || metrics == null || visualizationOptions == null) {
                throw new IllegalStateException("config, networkOptions, metrics and visualizationOptions are required");
            }
            return new OptimizationPipeline(this);
        }
    }
}
