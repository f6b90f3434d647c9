package com.example.archiveindexer;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a successful build.
 *
 * @param full               whether every page was regenerated
 * @param reason             why the plan was full or incremental
 * @param written            generated files, relative to the output directory
 * @param digestsRecomputed  files hashed instead of served from the checksum cache
 * @param warnings           diagnostics collected during the run
 * @param elapsed            wall time of the run
 */
public record BuildReport(
        boolean full,
        String reason,
        List<String> written,
        int digestsRecomputed,
        List<BuildDiagnostics.Diagnostic> warnings,
        Duration elapsed
) {
    public int pagesWritten() {
        return written.size();
    }
}
