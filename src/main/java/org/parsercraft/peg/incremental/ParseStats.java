package org.parsercraft.peg.incremental;

import java.time.Duration;

/**
 * Snapshot of incremental parser statistics.
 *
 * @param incrementalParses edits handled by re-parsing one region
 * @param fullParses        full parses, including fallbacks that failed
 * @param lastParse         duration of the most recent parse or edit
 */
public record ParseStats(int incrementalParses, int fullParses, Duration lastParse) {

    public int totalParses() {
        return incrementalParses + fullParses;
    }
}
