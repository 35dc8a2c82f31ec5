package com.trust.network.pipeline;

import com.trust.network.export.ExportResult;
import com.trust.network.graph.BuildReport;
import com.trust.network.graph.NetworkSnapshot;
import com.trust.network.maintenance.MaintenanceSelection;
import com.trust.network.selection.RoleAssignment;
import com.trust.network.sentinel.SentinelSelection;

import java.util.Optional;

/**
 * Everything one pipeline run produced.
 *
 * @param runId       identifier used in the log context of the run
 * @param snapshot    the network the selectors ran on
 * @param sentinels   exact, greedy and naive sentinel selections
 * @param maintenance exact and approximate maintenance selections
 * @param roles       node roles from the production selections
 * @param export      artifact locations; empty when no output directory was configured
 */
public record PipelineResult(
        String runId,
        NetworkSnapshot snapshot,
        SentinelSelection sentinels,
        MaintenanceSelection maintenance,
        RoleAssignment roles,
        Optional<ExportResult> export
) {
    public BuildReport buildReport() {
        return snapshot.buildReport();
    }
}
