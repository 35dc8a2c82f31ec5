package com.trust.network.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trust.network.config.MaintenanceOrdering;
import com.trust.network.config.OptimizationConfig;
import com.trust.network.core.model.Endorsement;
import com.trust.network.core.model.IdentityMetadata;
import com.trust.network.core.model.NodeRole;
import com.trust.network.graph.NetworkSnapshot;
import com.trust.network.logging.LogContext;
import com.trust.network.maintenance.MaintenanceCandidate;
import com.trust.network.maintenance.MaintenanceSelection;
import com.trust.network.selection.RoleAssignment;
import com.trust.network.selection.SelectionResult;
import com.trust.network.sentinel.SentinelSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Turns the snapshot and both selections into the three JSON artifacts.
 *
 * <p>Documents are built first, then each is serialized into a temporary file in the
 * destination directory. Only when all three are written are they moved over their
 * final names, each replaced file kept as a backup until all three are in place. A
 * failure deletes the temporary files, puts the previous artifacts back and raises
 * {@link ExportException}.</p>
 *
 * <p>The exporter performs no selection: {@code group} tags come from the supplied
 * {@link RoleAssignment}.</p>
 */
public class ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(ResultExporter.class);

    public static final String GRAPH_VIZ_FILE = "graph_viz.json";
    public static final String SENTINEL_RESULTS_FILE = "sentinel_results.json";
    public static final String MAINTENANCE_RESULTS_FILE = "maintenance_results.json";

    static final String GROUP_MAINTENANCE = "maintenance";
    static final String GROUP_SENTINEL_MAINTENANCE = "sentinel_maintenance";

    private final ObjectMapper objectMapper;
    private final OptimizationConfig config;
    private final VisualizationOptions visualization;

    public ResultExporter(OptimizationConfig config) {
        this(config, VisualizationOptions.defaults());
    }

    public ResultExporter(OptimizationConfig config, VisualizationOptions visualization) {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), config, visualization);
    }

    public ResultExporter(ObjectMapper objectMapper, OptimizationConfig config, VisualizationOptions visualization) {
        this.objectMapper = objectMapper;
        this.config = config;
        this.visualization = visualization;
    }

    /**
     * Writes all three artifacts into {@code directory}, creating it if needed.
     *
     * @throws ExportException if the directory or any artifact cannot be written
     */
    public ExportResult export(NetworkSnapshot snapshot, SentinelSelection sentinels, MaintenanceSelection maintenance,
                               RoleAssignment roles, Path directory) {
        return export(null, snapshot, sentinels, maintenance, roles, directory);
    }

    public ExportResult export(String runId, NetworkSnapshot snapshot, SentinelSelection sentinels,
                               MaintenanceSelection maintenance, RoleAssignment roles, Path directory) {
        try (LogContext ignored = LogContext.forExport(runId, String.valueOf(directory))) {
            GraphVizDocument graph = graphViz(snapshot, sentinels, maintenance, roles);
            SentinelResultsDocument sentinelDoc = sentinelResults(sentinels);
            MaintenanceResultsDocument maintenanceDoc = maintenanceResults(snapshot, maintenance);

            Map<String, Object> documents = new LinkedHashMap<>();
            documents.put(GRAPH_VIZ_FILE, graph);
            documents.put(SENTINEL_RESULTS_FILE, sentinelDoc);
            documents.put(MAINTENANCE_RESULTS_FILE, maintenanceDoc);
            writeAll(directory, documents);

            log.info("export.completed directory={} vizNodes={} vizLinks={} sentinels={} maintenance={}",
                    directory, graph.nodes().size(), graph.links().size(),
                    sentinelDoc.ip().sentinels().size(), maintenanceDoc.numSelected());
            return new ExportResult(directory.resolve(GRAPH_VIZ_FILE),
                    directory.resolve(SENTINEL_RESULTS_FILE),
                    directory.resolve(MAINTENANCE_RESULTS_FILE));
        }
    }

    /**
     * Builds the visualization subgraph document.
     */
    public GraphVizDocument graphViz(NetworkSnapshot snapshot, SentinelSelection sentinels,
                                     MaintenanceSelection maintenance, RoleAssignment roles) {
        SortedSet<Long> nodes = visualizationNodes(snapshot, sentinels, maintenance);

        List<GraphVizDocument.Link> links = new ArrayList<>();
        Map<Long, Integer> visibleDegree = new HashMap<>();
        Set<List<Long>> seenPairs = new HashSet<>();
        for (Endorsement edge : snapshot.edges()) {
            long source = edge.sourceId();
            long target = edge.targetId();
            if (!nodes.contains(source) || !nodes.contains(target)) {
                continue;
            }
            if (seenPairs.add(List.of(Math.min(source, target), Math.max(source, target)))) {
                links.add(new GraphVizDocument.Link(source, target));
                visibleDegree.merge(source, 1, Integer::sum);
                visibleDegree.merge(target, 1, Integer::sum);
            }
        }

        List<GraphVizDocument.Node> entries = new ArrayList<>(nodes.size());
        for (Long id : nodes) {
            entries.add(new GraphVizDocument.Node(
                    id,
                    groupOf(roles.roleOf(id)),
                    snapshot.score(id),
                    visibleDegree.getOrDefault(id, 0),
                    snapshot.degree(id),
                    "Node " + id,
                    metadataOf(snapshot, id)));
        }
        return new GraphVizDocument(entries, links);
    }

    /**
     * Builds the sentinel comparison document.
     */
    public SentinelResultsDocument sentinelResults(SentinelSelection sentinels) {
        return new SentinelResultsDocument(
                method(sentinels.exact()),
                method(sentinels.greedy()),
                method(sentinels.naive()),
                new SentinelResultsDocument.Comparison(
                        sentinels.greedyVsOptimalPct(),
                        sentinels.naiveVsOptimalPct(),
                        sentinels.exactImprovementOverNaivePct(),
                        sentinels.greedySpeedupFactor()));
    }

    /**
     * Builds the maintenance document from the production (exact or fallback) selection.
     */
    public MaintenanceResultsDocument maintenanceResults(NetworkSnapshot snapshot, MaintenanceSelection maintenance) {
        SelectionResult result = maintenance.exact();
        List<MaintenanceCandidate> selected = new ArrayList<>(maintenance.selectedCandidates(result));
        selected.sort(orderingOf(config.getMaintenanceOrdering()));

        List<MaintenanceResultsDocument.SelectedNode> nodes = new ArrayList<>(selected.size());
        for (MaintenanceCandidate candidate : selected) {
            long id = candidate.id();
            boolean known = snapshot.contains(id);
            nodes.add(new MaintenanceResultsDocument.SelectedNode(
                    id,
                    candidate.cost(),
                    candidate.value(),
                    candidate.daysDormant(),
                    known ? snapshot.degree(id) : candidate.degree(),
                    candidate.talentScore(),
                    known ? metadataOf(snapshot, id) : NodeMetadata.from(IdentityMetadata.placeholder())));
        }
        return new MaintenanceResultsDocument(
                nodes,
                result.objective(),
                result.budgetUsed(),
                nodes.size(),
                maintenance.avgDaysDormant(result),
                provenanceOf(result),
                result.fallbackReason().map(Enum::name).orElse(null));
    }

    /**
     * Every node referenced by either results document, plus context nodes.
     */
    SortedSet<Long> visualizationNodes(NetworkSnapshot snapshot, SentinelSelection sentinels,
                                       MaintenanceSelection maintenance) {
        if (visualization.isFullGraph()) {
            return new TreeSet<>(snapshot.allNodeIds());
        }
        SortedSet<Long> important = new TreeSet<>();
        addKnown(snapshot, important, sentinels.exact().selected());
        addKnown(snapshot, important, sentinels.greedy().selected());
        addKnown(snapshot, important, sentinels.naive().selected());
        addKnown(snapshot, important, maintenance.exact().selected());

        snapshot.allNodeIds().stream()
                .sorted(Comparator.comparingDouble((Long id) -> snapshot.score(id)).reversed()
                        .thenComparingLong(id -> id))
                .limit(visualization.getTopTalentContext())
                .forEach(important::add);

        SortedSet<Long> nodes = new TreeSet<>(important);
        for (Long id : important) {
            snapshot.neighbors(id).stream()
                    .limit(visualization.getNeighborsPerNode())
                    .forEach(nodes::add);
        }
        return nodes;
    }

    private static void addKnown(NetworkSnapshot snapshot, Set<Long> target, List<Long> ids) {
        for (Long id : ids) {
            if (snapshot.contains(id)) {
                target.add(id);
            } else {
                log.warn("export.unknownNode id={} reason=selected node is not in the snapshot", id);
            }
        }
    }

    private String groupOf(NodeRole role) {
        return switch (role) {
            case SENTINEL_MAINTENANCE -> GROUP_SENTINEL_MAINTENANCE;
            case SENTINEL -> config.getSentinelGroupSource().groupTag();
            case MAINTENANCE -> GROUP_MAINTENANCE;
            case NONE -> null;
        };
    }

    private static NodeMetadata metadataOf(NetworkSnapshot snapshot, long id) {
        return NodeMetadata.from(snapshot.identity(id).orElseGet(IdentityMetadata::placeholder));
    }

    private static SentinelResultsDocument.Method method(SelectionResult result) {
        return new SentinelResultsDocument.Method(
                result.selected(),
                result.objective(),
                result.runtime().toNanos() / 1_000_000_000.0,
                provenanceOf(result),
                result.fallbackReason().map(Enum::name).orElse(null));
    }

    private static String provenanceOf(SelectionResult result) {
        return result.provenance().name().toLowerCase(Locale.ROOT);
    }

    static Comparator<MaintenanceCandidate> orderingOf(MaintenanceOrdering ordering) {
        Comparator<MaintenanceCandidate> primary = switch (ordering) {
            case DAYS_DORMANT_DESC -> Comparator.comparingLong(MaintenanceCandidate::daysDormant).reversed();
            case VALUE_DESC -> Comparator.comparingDouble(MaintenanceCandidate::value).reversed();
        };
        return primary.thenComparingLong(MaintenanceCandidate::id);
    }

    private void writeAll(Path directory, Map<String, Object> documents) {
        Map<String, Path> staged = new LinkedHashMap<>();
        Map<Path, Path> backups = new LinkedHashMap<>();
        List<Path> installed = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            for (String name : documents.keySet()) {
                Path target = directory.resolve(name);
                if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)
                        && !Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                    throw new ExportException("Cannot replace " + target + ": not a regular file");
                }
            }
            for (Map.Entry<String, Object> document : documents.entrySet()) {
                Path tmp = Files.createTempFile(directory, "." + document.getKey() + "-", ".tmp");
                staged.put(document.getKey(), tmp);
                Files.write(tmp, serialize(document.getKey(), document.getValue()));
            }
            for (Map.Entry<String, Path> entry : staged.entrySet()) {
                Path target = directory.resolve(entry.getKey());
                if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                    Path backup = directory.resolve("." + entry.getKey() + "-" + UUID.randomUUID() + ".bak");
                    replace(target, backup);
                    backups.put(target, backup);
                }
                replace(entry.getValue(), target);
                installed.add(target);
            }
            staged.clear();
            discard(backups.values());
            backups.clear();
        } catch (IOException e) {
            ExportException failure = new ExportException(
                    "Cannot write results to " + directory + ": " + e.getMessage(), e);
            rollback(installed, backups, failure);
            throw failure;
        } finally {
            discard(staged.values());
        }
    }

    /**
     * Puts the previous artifacts back after a failed finalize: new files are removed and
     * every backed-up file returns to its name.
     */
    private void rollback(List<Path> installed, Map<Path, Path> backups, ExportException failure) {
        for (Path target : installed) {
            if (!backups.containsKey(target)) {
                try {
                    Files.deleteIfExists(target);
                } catch (IOException e) {
                    failure.addSuppressed(e);
                }
            }
        }
        for (Map.Entry<Path, Path> backup : backups.entrySet()) {
            try {
                replace(backup.getValue(), backup.getKey());
            } catch (IOException e) {
                log.error("export.rollback failed to restore {} from {}: {}",
                        backup.getKey(), backup.getValue(), e.getMessage());
                failure.addSuppressed(e);
            }
        }
        log.warn("export.rolledBack installed={} restored={}", installed.size(), backups.size());
    }

    private byte[] serialize(String name, Object document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new ExportException("Cannot serialize " + name + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Moves {@code from} over {@code to}, atomically where the file system allows it.
     */
    void replace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("export.move atomic move unsupported for {}, replacing", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Iterable<Path> temporaries) {
        for (Path tmp : temporaries) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("export.cleanup failed to delete {}: {}", tmp, e.getMessage());
            }
        }
    }
}
