package ch.so.arp.rag.text2sql.knowledge;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one knowledge base build.
 *
 * @param skipped whether the build was skipped because the index was already populated
 * @param tables number of tables read from the metadata source
 * @param chunks number of chunks in the new set
 * @param embedded number of chunks whose text changed and had to be embedded
 * @param removedTables tables that disappeared from the metadata and were deleted
 * @param removedChunkIds chunk ids deleted because they are no longer produced
 * @param selfMatchFailures ids of chunks that did not rank first for their own vector
 * @param elapsed wall clock duration of the build
 */
public record BuildReport(
        boolean skipped,
        int tables,
        int chunks,
        int embedded,
        List<String> removedTables,
        List<String> removedChunkIds,
        List<String> selfMatchFailures,
        Duration elapsed) {

    public BuildReport {
        removedTables = List.copyOf(removedTables);
        removedChunkIds = List.copyOf(removedChunkIds);
        selfMatchFailures = List.copyOf(selfMatchFailures);
    }

    static BuildReport skipped(int chunks) {
        return new BuildReport(true, 0, chunks, 0, List.of(), List.of(), List.of(), Duration.ZERO);
    }

    public boolean verified() {
        return selfMatchFailures.isEmpty();
    }
}
