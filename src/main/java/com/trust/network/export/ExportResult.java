package com.trust.network.export;

import java.nio.file.Path;

/**
 * Final locations of the three artifacts of a completed export.
 */
public record ExportResult(Path graphViz, Path sentinelResults, Path maintenanceResults) {
}
